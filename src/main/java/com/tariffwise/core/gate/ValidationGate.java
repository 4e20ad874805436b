package com.tariffwise.core.gate;

import com.tariffwise.core.model.GateResult;

/**
 * One step of the post-processing pipeline. Gates mutate the shared {@link GateContext}
 * and report what they found.
 */
public interface ValidationGate {

    String name();

    GateResult apply(GateContext context);
}
