package com.tariffwise.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.ProductLine;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/classifications.
 *
 * @param requestId      correlation id; nullable, generated when absent
 * @param subject        subject of the originating message; nullable
 * @param referenceId    upstream message id; nullable
 * @param lines          product lines, at least one
 * @param context        free-text context; nullable
 * @param enrichment     pre-enrichment text; nullable
 * @param timeoutSeconds caller deadline in seconds; nullable, the orchestrator budget applies alone
 */
public record ClassificationRequestBody(
    @JsonProperty("request_id") String requestId,
    String subject,
    @JsonProperty("reference_id") String referenceId,
    List<ProductLine> lines,
    String context,
    String enrichment,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds
) {

    /**
     * @throws IllegalArgumentException when there are no lines
     */
    public ClassificationRequest toRequest() {
        return new ClassificationRequest(requestId, subject, referenceId, lines, context, enrichment);
    }
}
