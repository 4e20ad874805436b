package com.tariffwise.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Result of one validation gate.
 * <p>
 * {@code evaluated=false} means the gate hit an internal fault and was skipped; callers can
 * tell that apart from a gate that ran and passed.
 */
public record GateResult(
    @JsonProperty("gate_name") String gateName,
    boolean evaluated,
    boolean passed,
    List<String> findings,
    boolean blocking
) implements Serializable {

    public GateResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static GateResult passed(String gateName, List<String> findings) {
        return new GateResult(gateName, true, true, findings, false);
    }

    public static GateResult flagged(String gateName, List<String> findings) {
        return new GateResult(gateName, true, false, findings, false);
    }

    public static GateResult blocked(String gateName, List<String> findings) {
        return new GateResult(gateName, true, false, findings, true);
    }

    public static GateResult notEvaluated(String gateName, String reason) {
        return new GateResult(gateName, false, false, List.of(reason), false);
    }
}
