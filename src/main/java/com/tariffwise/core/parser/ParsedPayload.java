package com.tariffwise.core.parser;

import com.tariffwise.core.model.CandidateClassification;

import java.util.List;

/**
 * Structured content extracted from model output.
 *
 * @param candidates one candidate per product line the model (or memory) addressed
 * @param synthesis  free-text summary the model wrote alongside the codes; may be empty
 */
public record ParsedPayload(List<CandidateClassification> candidates, String synthesis) {

    public ParsedPayload {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        synthesis = synthesis == null ? "" : synthesis;
    }

    public static ParsedPayload empty() {
        return new ParsedPayload(List.of(), "");
    }

    public boolean isEmpty() {
        return candidates.isEmpty() && synthesis.isBlank();
    }
}
