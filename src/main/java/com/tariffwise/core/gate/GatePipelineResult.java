package com.tariffwise.core.gate;

import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.GateAuditEntry;
import com.tariffwise.core.model.GateResult;

import java.util.List;

/**
 * What the gate pipeline produced for one request.
 */
public record GatePipelineResult(
    List<CandidateClassification> candidates,
    List<GateResult> gateResults,
    List<GateAuditEntry> auditTrail,
    List<String> blockingIssues,
    List<String> warnings,
    AttemptStatus attemptStatus,
    String cleanedText,
    List<String> phrasesFound
) {

    public GatePipelineResult {
        candidates = List.copyOf(candidates);
        gateResults = List.copyOf(gateResults);
        auditTrail = List.copyOf(auditTrail);
        blockingIssues = List.copyOf(blockingIssues);
        warnings = List.copyOf(warnings);
        phrasesFound = List.copyOf(phrasesFound);
    }

    public boolean escalate() {
        return attemptStatus != null && attemptStatus.escalate();
    }
}
