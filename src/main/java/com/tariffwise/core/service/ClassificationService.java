package com.tariffwise.core.service;

import com.tariffwise.core.events.ClassificationEvent;
import com.tariffwise.core.events.EventBus;
import com.tariffwise.core.gate.GatePipelineResult;
import com.tariffwise.core.gate.ValidationGatePipeline;
import com.tariffwise.core.llm.ModelProviders;
import com.tariffwise.core.logging.MdcContext;
import com.tariffwise.core.memory.ClassificationMemory;
import com.tariffwise.core.memory.MemoryHit;
import com.tariffwise.core.memory.MemoryProperties;
import com.tariffwise.core.metrics.ClassificationMetrics;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.FinalPayload;
import com.tariffwise.core.model.OrchestrationSummary;
import com.tariffwise.core.model.PayloadStatus;
import com.tariffwise.core.model.ProductLine;
import com.tariffwise.core.orchestrator.OrchestrationResult;
import com.tariffwise.core.orchestrator.ToolCallingOrchestrator;
import com.tariffwise.core.parser.ParsedPayload;
import com.tariffwise.core.parser.ResponseParser;
import com.tariffwise.core.persistence.AttemptRecordStore;
import com.tariffwise.core.tools.RequestScope;
import com.tariffwise.core.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for one classification request.
 * <p>
 * Looks every line up in memory, runs the tool loop for the lines memory could not answer,
 * parses and merges the result, runs the gate pipeline, then records prior codes and learns
 * from the outcome. {@link #classify} never throws; every outcome is a {@link FinalPayload}.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    private final ClassificationMemory memory;
    private final MemoryProperties memoryProps;
    private final PromptBuilder promptBuilder;
    private final ToolRegistry toolRegistry;
    private final ToolCallingOrchestrator orchestrator;
    private final ModelProviders providers;
    private final ResponseParser parser;
    private final ValidationGatePipeline gates;
    private final AttemptRecordStore attemptStore;
    private final ClassificationLearner learner;
    private final EventBus eventBus;
    private final ClassificationMetrics metrics;
    private final Clock clock;

    @Autowired
    public ClassificationService(ClassificationMemory memory, MemoryProperties memoryProps,
                                 PromptBuilder promptBuilder, ToolRegistry toolRegistry,
                                 ToolCallingOrchestrator orchestrator, ModelProviders providers,
                                 ResponseParser parser, ValidationGatePipeline gates,
                                 AttemptRecordStore attemptStore, ClassificationLearner learner,
                                 EventBus eventBus,
                                 @Autowired(required = false) ClassificationMetrics metrics) {
        this(memory, memoryProps, promptBuilder, toolRegistry, orchestrator, providers, parser, gates,
                attemptStore, learner, eventBus, metrics, Clock.systemUTC());
    }

    public ClassificationService(ClassificationMemory memory, MemoryProperties memoryProps,
                                 PromptBuilder promptBuilder, ToolRegistry toolRegistry,
                                 ToolCallingOrchestrator orchestrator, ModelProviders providers,
                                 ResponseParser parser, ValidationGatePipeline gates,
                                 AttemptRecordStore attemptStore, ClassificationLearner learner,
                                 EventBus eventBus, ClassificationMetrics metrics, Clock clock) {
        this.memory = memory;
        this.memoryProps = memoryProps;
        this.promptBuilder = promptBuilder;
        this.toolRegistry = toolRegistry;
        this.orchestrator = orchestrator;
        this.providers = providers;
        this.parser = parser;
        this.gates = gates;
        this.attemptStore = attemptStore;
        this.learner = learner;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public FinalPayload classify(ClassificationRequest request) {
        return classify(request, null);
    }

    /**
     * @param deadline the caller's own deadline; the tool loop stops when it passes. Nullable.
     */
    public FinalPayload classify(ClassificationRequest request, Instant deadline) {
        Instant start = clock.instant();
        MdcContext.setRequest(request.requestId());
        FinalPayload payload;
        try {
            log.info("Classifying {} line(s)", request.lines().size());
            payload = doClassify(request, start, deadline);
        } catch (RuntimeException e) {
            log.error("Classification failed unexpectedly: {}", e.getMessage(), e);
            payload = FinalPayload.noClassification(request.requestId(), "Internal error: " + e.getMessage(), null);
        } finally {
            MdcContext.clear();
        }
        long elapsedMs = Duration.between(start, clock.instant()).toMillis();
        finish(payload, elapsedMs);
        return payload;
    }

    private FinalPayload doClassify(ClassificationRequest request, Instant start, Instant deadline) {
        List<MemoryHit> shortcuts = new ArrayList<>();
        List<ProductLine> unresolved = new ArrayList<>();
        for (ProductLine line : request.lines()) {
            Optional<MemoryHit> hit = lookupMemory(line.description());
            if (hit.isPresent() && hit.get().isShortcut(memoryProps.getHitThreshold())) {
                shortcuts.add(hit.get());
            } else {
                unresolved.add(line);
            }
        }

        List<String> warnings = new ArrayList<>();
        ParsedPayload parsed;
        OrchestrationSummary summary;
        boolean degraded = false;

        if (unresolved.isEmpty()) {
            log.info("All {} line(s) answered from memory; model not called", shortcuts.size());
            if (metrics != null) {
                metrics.recordMemoryShortcut();
            }
            parsed = parser.merge(ParsedPayload.empty(), shortcuts);
            summary = OrchestrationSummary.skipped();
        } else {
            RequestScope scope = new RequestScope(request.requestId(), start, deadline);
            OrchestrationResult result = orchestrator.run(promptBuilder.build(request, unresolved),
                    toolRegistry.dispatcherFor(scope), providers);
            summary = result.summary();
            if (result.isFailure()) {
                if (shortcuts.isEmpty()) {
                    return FinalPayload.noClassification(request.requestId(),
                            "No classification produced: all providers failed", summary);
                }
                warnings.add("Model unavailable; only memory answers are included");
            } else if (result.isDegraded()) {
                degraded = true;
                warnings.add("Model run ended early (" + result.outcome() + "); output may be incomplete");
            }
            parsed = parser.parse(result.finalText(), shortcuts);
            if (parsed.candidates().isEmpty() && !result.isFailure()) {
                warnings.add("No structured classification found in model output");
            }
        }

        GatePipelineResult gated = gates.run(request, parsed.candidates(), parsed.synthesis());
        warnings.addAll(gated.warnings());

        PayloadStatus status = decideStatus(gated, warnings, degraded);
        if (!gated.escalate()) {
            recordPriorCodes(gated);
            learner.learn(gated.candidates());
        }

        // an escalated thread goes to a human; automated candidates are withheld
        List<CandidateClassification> released = gated.escalate() ? List.of() : gated.candidates();
        return new FinalPayload(request.requestId(), status, gated.cleanedText(), released,
                gated.blockingIssues(), warnings, gated.gateResults(), gated.auditTrail(),
                gated.phrasesFound(), gated.attemptStatus(), summary);
    }

    private Optional<MemoryHit> lookupMemory(String description) {
        try {
            return memory.lookup(description);
        } catch (RuntimeException e) {
            log.warn("Memory lookup failed for '{}'; continuing without it: {}", description, e.getMessage());
            return Optional.empty();
        }
    }

    static PayloadStatus decideStatus(GatePipelineResult gated, List<String> warnings, boolean degraded) {
        if (gated.escalate()) {
            return PayloadStatus.ESCALATION_REQUIRED;
        }
        if (gated.candidates().isEmpty()) {
            return PayloadStatus.NO_CLASSIFICATION;
        }
        boolean allReleasable = gated.candidates().stream().allMatch(CandidateClassification::isReleasable);
        if (!allReleasable || degraded || !warnings.isEmpty() || !gated.blockingIssues().isEmpty()) {
            return PayloadStatus.CLASSIFIED_WITH_WARNINGS;
        }
        return PayloadStatus.CLASSIFIED;
    }

    private void recordPriorCodes(GatePipelineResult gated) {
        String threadKey = gated.attemptStatus().threadKey();
        if (threadKey == null) {
            return;
        }
        List<String> codes = gated.candidates().stream()
                .filter(CandidateClassification::isReleasable)
                .map(CandidateClassification::getCode)
                .distinct()
                .toList();
        try {
            attemptStore.recordCodes(threadKey, codes);
        } catch (RuntimeException e) {
            log.warn("Could not record codes for thread {}: {}", threadKey, e.getMessage());
        }
    }

    private void finish(FinalPayload payload, long elapsedMs) {
        if (metrics != null) {
            metrics.recordPayload(payload.status().name(), elapsedMs);
            if (payload.escalationRequired()) {
                metrics.incrementEscalations("loop_breaker");
            }
        }
        String eventType = switch (payload.status()) {
            case ESCALATION_REQUIRED -> ClassificationEvent.ESCALATED;
            case NO_CLASSIFICATION -> ClassificationEvent.FAILED;
            default -> ClassificationEvent.COMPLETED;
        };
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", payload.status().name());
        summary.put("candidates", payload.candidates().size());
        summary.put("codes", payload.candidates().stream()
                .filter(CandidateClassification::isReleasable)
                .map(CandidateClassification::getCode)
                .toList());
        if (payload.escalationRequired() && payload.attempt() != null) {
            summary.put("priorCodes", payload.attempt().priorCodes());
        }
        summary.put("blockingIssues", payload.blockingIssues().size());
        summary.put("elapsedMs", elapsedMs);
        eventBus.publish(new ClassificationEvent(eventType, payload.requestId(), summary, clock.instant()));
        log.info("Request {} finished: {} in {}ms", payload.requestId(), payload.status(), elapsedMs);
    }
}
