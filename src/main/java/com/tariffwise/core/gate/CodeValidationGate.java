package com.tariffwise.core.gate;

import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.CandidateStatus;
import com.tariffwise.core.model.GateResult;
import com.tariffwise.core.reference.ReferenceDataset;
import com.tariffwise.core.reference.ReferenceRecord;
import com.tariffwise.core.reference.TariffCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Checks every candidate code against the reference dataset.
 * <p>
 * An exact match is marked valid with the canonical description and duty rate. A miss is
 * replaced by the best sibling under the same heading, then under the same chapter. When no
 * sibling exists at either level the candidate is flagged invalid and a blocking issue is
 * recorded; nothing is dropped.
 * <p>
 * Running the gate twice leaves candidates unchanged: a corrected code is found by exact
 * lookup on the second pass and keeps its corrected status.
 */
@Component
public class CodeValidationGate implements ValidationGate {

    private static final Logger log = LoggerFactory.getLogger(CodeValidationGate.class);

    public static final String NAME = "code_validation";

    private final ReferenceDataset reference;
    private final GateProperties.CodeValidation props;

    public CodeValidationGate(ReferenceDataset reference, GateProperties props) {
        this.reference = reference;
        this.props = props.getCodeValidation();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult apply(GateContext context) {
        List<String> findings = new ArrayList<>();
        int invalid = 0;
        int corrected = 0;

        for (CandidateClassification candidate : context.candidates()) {
            String item = candidate.getItemDescription();
            if (!candidate.hasCode()) {
                candidate.markInvalid("No code was proposed");
                context.addBlockingIssue("No code proposed for '" + item + "'");
                context.audit(NAME, item, "flagged_invalid", "No code was proposed");
                findings.add(item + ": no code");
                invalid++;
                continue;
            }

            String proposed = TariffCodes.normalize(candidate.getCode());
            Optional<ReferenceRecord> exact = reference.lookupByCode(proposed);
            if (exact.isPresent()) {
                ReferenceRecord record = exact.get();
                candidate.markValid(record.code(), record.description(), record.dutyRate());
                context.audit(NAME, item, "validated", "Code " + TariffCodes.format(record.code()) + " exists");
                if (candidate.getStatus() == CandidateStatus.CORRECTED) {
                    corrected++;
                }
                continue;
            }

            Optional<ReferenceRecord> sibling = bestSibling(proposed, item, props.getHeadingDigits())
                    .or(() -> bestSibling(proposed, item, props.getChapterDigits()));
            if (sibling.isPresent()) {
                ReferenceRecord record = sibling.get();
                String reason = "Code " + TariffCodes.format(proposed) + " not found; substituted sibling "
                        + TariffCodes.format(record.code());
                candidate.correctTo(record.code(), record.description(), record.dutyRate(), reason);
                context.audit(NAME, item, "corrected", reason);
                findings.add(item + ": " + reason);
                log.info("Corrected '{}' from {} to {}", item, proposed, record.code());
                corrected++;
            } else {
                String reason = "Code " + TariffCodes.format(proposed) + " not found and no sibling code exists";
                candidate.markInvalid(reason);
                context.addBlockingIssue("Invalid code for '" + item + "': " + reason);
                context.audit(NAME, item, "flagged_invalid", reason);
                findings.add(item + ": " + reason);
                log.warn("No valid code for '{}' (proposed {})", item, proposed);
                invalid++;
            }
        }

        if (invalid > 0) {
            return GateResult.flagged(NAME, findings);
        }
        if (corrected > 0) {
            findings.add(0, corrected + " candidate(s) corrected to sibling codes");
        }
        return GateResult.passed(NAME, findings);
    }

    /**
     * Highest-scoring record sharing the first {@code digits} digits of the proposed code.
     * Score order: longest shared prefix, then description token overlap, then lowest code.
     */
    private Optional<ReferenceRecord> bestSibling(String proposed, String itemDescription, int digits) {
        String prefix = TariffCodes.prefix(proposed, digits);
        if (prefix == null) {
            return Optional.empty();
        }
        List<ReferenceRecord> siblings = reference.searchPrefix(prefix);
        if (siblings.isEmpty()) {
            return Optional.empty();
        }
        Set<String> itemTokens = tokens(itemDescription);
        Comparator<ReferenceRecord> byScore = Comparator
                .comparingInt((ReferenceRecord r) -> sharedPrefixLength(proposed, r.code()))
                .thenComparingInt(r -> overlap(itemTokens, tokens(r.description())))
                .reversed()
                .thenComparing(ReferenceRecord::code);
        return siblings.stream().min(byScore);
    }

    static int sharedPrefixLength(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    private static int overlap(Set<String> a, Set<String> b) {
        int count = 0;
        for (String token : a) {
            if (b.contains(token)) {
                count++;
            }
        }
        return count;
    }

    private static Set<String> tokens(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 2) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
