package com.tariffwise.core.service;

import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.CandidateStatus;
import com.tariffwise.core.reference.TariffCodes;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders validated candidates into the reply text handed to the content filter.
 */
@Component
public class PayloadRenderer {

    public String render(List<CandidateClassification> candidates, String synthesis, AttemptStatus attempt) {
        StringBuilder sb = new StringBuilder();

        if (attempt != null && attempt.escalate()) {
            sb.append("This request has been escalated for manual review after ")
              .append(attempt.attemptNumber() - 1)
              .append(" automated attempt(s).");
            if (!attempt.priorCodes().isEmpty()) {
                sb.append(" Previously proposed codes: ")
                  .append(String.join(", ", attempt.priorCodes().stream().map(TariffCodes::format).toList()))
                  .append('.');
            }
            sb.append('\n');
            return sb.toString().strip();
        }

        if (candidates.isEmpty()) {
            sb.append("No classification could be produced for this request.\n");
        }
        for (int i = 0; i < candidates.size(); i++) {
            CandidateClassification c = candidates.get(i);
            sb.append(i + 1).append(". ").append(c.getItemDescription()).append('\n');
            if (c.getStatus() == CandidateStatus.INVALID) {
                sb.append("   Code: ").append(c.hasCode() ? TariffCodes.format(c.getCode()) : "none")
                  .append(" (not confirmed: ").append(c.getStatusReason()).append(")\n");
            } else {
                sb.append("   Code: ").append(TariffCodes.format(c.getCode()));
                if (c.getReferenceDescription() != null) {
                    sb.append(" - ").append(c.getReferenceDescription());
                }
                sb.append('\n');
                if (c.isCorrected()) {
                    sb.append("   Corrected from ").append(TariffCodes.format(c.getOriginalCode())).append('\n');
                }
                if (c.getDutyRate() != null && !c.getDutyRate().isBlank()) {
                    sb.append("   Duty rate: ").append(c.getDutyRate()).append('\n');
                }
                if (c.getStatus() == CandidateStatus.UNVERIFIED) {
                    sb.append("   Code could not be verified against the reference dataset\n");
                }
            }
            sb.append("   Confidence: ").append(c.getConfidence().name().toLowerCase(Locale.ROOT)).append('\n');
            if (!c.getReasoning().isBlank()) {
                sb.append("   Reasoning: ").append(c.getReasoning()).append('\n');
            }
        }

        if (synthesis != null && !synthesis.isBlank()) {
            sb.append('\n').append(synthesis.strip()).append('\n');
        }
        return sb.toString().strip();
    }
}
