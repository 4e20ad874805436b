package com.tariffwise.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.UUID;

/**
 * Immutable inbound classification request.
 *
 * @param requestId   correlation id; generated when null
 * @param subject     subject of the originating message, used to derive the thread key; nullable
 * @param referenceId upstream message id, used as thread key fallback when there is no subject; nullable
 * @param lines       one or more product lines
 * @param context     caller-supplied free-text context; nullable
 * @param enrichment  deterministic pre-enrichment text, passed to the model as opaque context; nullable
 */
public record ClassificationRequest(
    String requestId,
    String subject,
    String referenceId,
    List<ProductLine> lines,
    String context,
    String enrichment
) implements Serializable {

    public ClassificationRequest {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("A classification request needs at least one product line");
        }
        lines = List.copyOf(lines);
        if (requestId == null || requestId.isBlank()) {
            requestId = newRequestId();
        }
        context = context == null ? "" : context;
        enrichment = enrichment == null ? "" : enrichment;
    }

    public static ClassificationRequest of(String subject, List<ProductLine> lines) {
        return new ClassificationRequest(null, subject, null, lines, null, null);
    }

    public static String newRequestId() {
        return "CLS-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
