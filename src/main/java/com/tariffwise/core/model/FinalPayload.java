package com.tariffwise.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything produced for one classification request.
 * <p>
 * Every request yields a payload; degraded outcomes are explicit in {@link #status()} and
 * {@link #warnings()}.
 *
 * @param requestId      correlation id of the request
 * @param status         overall status
 * @param cleanedText    rendered reply text after the content filter
 * @param candidates     validated, corrected or flagged candidates
 * @param blockingIssues issues a human must look at before relying on the output (non-blocking in-process)
 * @param warnings       degraded-run notes
 * @param gateResults    one result per gate, in pipeline order
 * @param auditTrail     what each gate changed and why
 * @param phrasesFound   disallowed phrases replaced by the content filter
 * @param attempt        loop-breaker outcome
 * @param orchestration  summary of the model run
 */
public record FinalPayload(
    @JsonProperty("request_id") String requestId,
    PayloadStatus status,
    @JsonProperty("cleaned_text") String cleanedText,
    List<CandidateClassification> candidates,
    @JsonProperty("blocking_issues") List<String> blockingIssues,
    List<String> warnings,
    @JsonProperty("gate_results") List<GateResult> gateResults,
    @JsonProperty("audit_trail") List<GateAuditEntry> auditTrail,
    @JsonProperty("phrases_found") List<String> phrasesFound,
    AttemptStatus attempt,
    OrchestrationSummary orchestration
) {

    public FinalPayload {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        blockingIssues = blockingIssues == null ? List.of() : List.copyOf(blockingIssues);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        gateResults = gateResults == null ? List.of() : List.copyOf(gateResults);
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
        phrasesFound = phrasesFound == null ? List.of() : List.copyOf(phrasesFound);
    }

    /** Payload for a request that failed before any candidate could be produced. */
    public static FinalPayload noClassification(String requestId, String reason, OrchestrationSummary orchestration) {
        return new FinalPayload(requestId, PayloadStatus.NO_CLASSIFICATION, "", List.of(),
                List.of(reason), List.of(reason), List.of(), List.of(), List.of(),
                AttemptStatus.failOpen(null), orchestration == null ? OrchestrationSummary.skipped() : orchestration);
    }

    public boolean escalationRequired() {
        return status == PayloadStatus.ESCALATION_REQUIRED;
    }
}
