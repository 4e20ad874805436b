package com.tariffwise.core.gate;

import com.tariffwise.core.metrics.ClassificationMetrics;
import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.GateResult;
import com.tariffwise.core.service.PayloadRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs code validation, then the loop breaker, then renders the reply text and runs the
 * content filter over it.
 * <p>
 * A gate that throws is recorded as not evaluated and skipped; the request still produces a
 * payload. Specifically:
 * <ul>
 *   <li>code validation fault: candidates it did not reach are marked unverified</li>
 *   <li>loop breaker fault: the attempt is allowed and treated as a first attempt</li>
 *   <li>content filter fault: the rendered text is returned unfiltered with a warning</li>
 * </ul>
 */
@Service
public class ValidationGatePipeline {

    private static final Logger log = LoggerFactory.getLogger(ValidationGatePipeline.class);

    private final CodeValidationGate codeValidation;
    private final LoopBreakerGate loopBreaker;
    private final ContentFilterGate contentFilter;
    private final PayloadRenderer renderer;
    private final ClassificationMetrics metrics;

    public ValidationGatePipeline(CodeValidationGate codeValidation,
                                  LoopBreakerGate loopBreaker,
                                  ContentFilterGate contentFilter,
                                  PayloadRenderer renderer,
                                  @Autowired(required = false) ClassificationMetrics metrics) {
        this.codeValidation = codeValidation;
        this.loopBreaker = loopBreaker;
        this.contentFilter = contentFilter;
        this.renderer = renderer;
        this.metrics = metrics;
    }

    public GatePipelineResult run(ClassificationRequest request, List<CandidateClassification> candidates,
                                  String synthesis) {
        GateContext context = new GateContext(request, candidates);
        List<GateResult> results = new ArrayList<>();

        GateResult codeResult = runGate(codeValidation, context);
        if (!codeResult.evaluated()) {
            for (CandidateClassification candidate : context.candidates()) {
                candidate.markUnverified("Code validation unavailable");
            }
            context.addWarning("Code validation was skipped: " + String.join("; ", codeResult.findings()));
        }
        results.add(codeResult);

        GateResult loopResult = runGate(loopBreaker, context);
        if (!loopResult.evaluated()) {
            context.setAttemptStatus(AttemptStatus.failOpen(null));
            context.addWarning("Attempt tracking unavailable; request treated as a first attempt");
        }
        results.add(loopResult);

        context.setRenderedText(renderer.render(context.candidates(), synthesis, context.attemptStatus()));

        GateResult filterResult = runGate(contentFilter, context);
        if (!filterResult.evaluated()) {
            context.setCleanedText(context.renderedText());
            context.addWarning("Content filter was skipped; text is unfiltered");
        }
        results.add(filterResult);

        return new GatePipelineResult(context.candidates(), results, context.auditTrail(),
                context.blockingIssues(), context.warnings(), context.attemptStatus(),
                context.cleanedText(), context.phrasesFound());
    }

    private GateResult runGate(ValidationGate gate, GateContext context) {
        GateResult result;
        try {
            result = gate.apply(context);
        } catch (RuntimeException e) {
            log.warn("Gate '{}' failed and was skipped: {}", gate.name(), e.getMessage(), e);
            result = GateResult.notEvaluated(gate.name(), "Gate error: " + e.getMessage());
        }
        if (metrics != null) {
            metrics.recordGate(gate.name(), outcome(result));
        }
        return result;
    }

    private static String outcome(GateResult result) {
        if (!result.evaluated()) {
            return "not_evaluated";
        }
        if (result.blocking()) {
            return "blocked";
        }
        return result.passed() ? "passed" : "flagged";
    }
}
