package com.tariffwise.core.orchestrator;

import com.tariffwise.core.concurrent.BoundedCallExecutor;
import com.tariffwise.core.llm.ModelCallRequest;
import com.tariffwise.core.llm.ModelClient;
import com.tariffwise.core.llm.ModelProviders;
import com.tariffwise.core.llm.ModelReply;
import com.tariffwise.core.llm.ProviderUnavailableException;
import com.tariffwise.core.llm.ToolCallRequest;
import com.tariffwise.core.llm.ToolSpec;
import com.tariffwise.core.logging.MdcContext;
import com.tariffwise.core.metrics.ClassificationMetrics;
import com.tariffwise.core.tools.ToolDispatcher;
import com.tariffwise.core.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs the bounded multi-round tool-calling loop.
 * <p>
 * Each round sends the transcript and tool schema to the active provider, executes the tool
 * calls it asks for through the {@link ToolDispatcher}, and appends the results. The run ends
 * when the model answers without tool calls, when {@code maxRounds} is reached, or when the
 * time budget or the caller's deadline runs out.
 * <p>
 * A provider failure on round 0 switches once to the secondary provider with a fresh
 * transcript. Budgets are checked between rounds and between tool calls, and every external
 * call gets a timeout no longer than the remaining budget, so a run can overrun its budget by
 * at most one in-flight call.
 */
@Service
public class ToolCallingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ToolCallingOrchestrator.class);

    private final OrchestratorProperties props;
    private final BoundedCallExecutor executor;
    private final ClassificationMetrics metrics;
    private final Clock clock;

    @Autowired
    public ToolCallingOrchestrator(OrchestratorProperties props, BoundedCallExecutor executor,
                                   @Autowired(required = false) ClassificationMetrics metrics) {
        this(props, executor, metrics, Clock.systemUTC());
    }

    public ToolCallingOrchestrator(OrchestratorProperties props, BoundedCallExecutor executor,
                                   ClassificationMetrics metrics, Clock clock) {
        this.props = props;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
    }

    public OrchestrationResult run(OrchestrationPrompt prompt, ToolDispatcher dispatcher, ModelProviders providers) {
        Instant start = clock.instant();
        Instant budgetEnd = start.plus(props.getTimeBudget());
        Instant callerDeadline = dispatcher.scope().deadline().orElse(null);
        List<ToolSpec> tools = dispatcher.toolSpecs();

        Run run = new Run(start, providers.primary());
        Transcript transcript = Transcript.start(prompt);
        int round = 0;

        try {
            while (round < props.getMaxRounds()) {
                OrchestrationOutcome stop = checkStop(budgetEnd, callerDeadline);
                if (stop != null) {
                    log.warn("Stopping before round {}: {}", round, stop);
                    return run.finish(stop, run.lastText, dispatcher);
                }

                MdcContext.setRound(round, run.active.name());
                ModelReply reply;
                try {
                    reply = callProvider(run.active, transcript, tools, remaining(budgetEnd, callerDeadline));
                } catch (ProviderUnavailableException e) {
                    run.failures.add(new ProviderFailure(run.active.name(), round, e.getMessage()));
                    record(m -> m.recordProviderFailure(run.active.name()));
                    if (round == 0 && !run.switched && providers.hasSecondary()) {
                        log.warn("Provider '{}' failed on round 0 ({}); switching to '{}' with a fresh transcript",
                                run.active.name(), e.getMessage(), providers.secondary().name());
                        record(m -> m.recordProviderSwitch(run.active.name(), providers.secondary().name()));
                        run.active = providers.secondary();
                        run.switched = true;
                        transcript = Transcript.start(prompt);
                        continue;
                    }
                    if (round == 0 || run.lastText.isBlank()) {
                        log.error("No provider produced a usable reply: {}", e.getMessage());
                        return run.finish(OrchestrationOutcome.FAILED, "", dispatcher);
                    }
                    log.warn("Provider '{}' failed on round {}; returning last text as degraded result",
                            run.active.name(), round);
                    return run.finish(OrchestrationOutcome.PROVIDER_ERROR, run.lastText, dispatcher);
                }

                dispatcher.scope().recordCost(run.active.name(), reply.usage().costUsd());
                record(m -> m.recordProviderCall(run.active.name(), reply.usage().latencyMs(), reply.usage().costUsd()));
                if (!reply.text().isBlank()) {
                    run.lastText = reply.text();
                }

                if (!reply.hasToolCalls()) {
                    run.rounds.add(new ToolCallRound(round, run.active.name(), List.of(), reply.text(), reply.usage()));
                    return run.finish(OrchestrationOutcome.COMPLETED, reply.text(), dispatcher);
                }

                transcript.appendAssistant(reply.text(), reply.toolCalls());
                List<ToolInvocation> invocations = executeToolCalls(reply.toolCalls(), dispatcher, transcript,
                        budgetEnd, callerDeadline);
                run.rounds.add(new ToolCallRound(round, run.active.name(), invocations, reply.text(), reply.usage()));
                round++;
            }
            log.warn("Reached max rounds ({}) without completion", props.getMaxRounds());
            return run.finish(OrchestrationOutcome.MAX_ROUNDS_REACHED, run.lastText, dispatcher);
        } finally {
            MdcContext.clearRound();
        }
    }

    private List<ToolInvocation> executeToolCalls(List<ToolCallRequest> calls, ToolDispatcher dispatcher,
                                                  Transcript transcript, Instant budgetEnd, Instant callerDeadline) {
        List<ToolInvocation> invocations = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            ToolCallRequest call = calls.get(i);
            ToolResult result;
            if (i >= props.getMaxToolsPerRound()) {
                result = ToolResult.skipped(call.name(), props.getMaxToolsPerRound());
            } else if (checkStop(budgetEnd, callerDeadline) != null) {
                result = ToolResult.budgetExceeded(call.name());
            } else {
                Duration timeout = min(props.getToolCallTimeout(), remaining(budgetEnd, callerDeadline));
                result = dispatcher.execute(call.name(), call.argumentsJson(), timeout);
            }
            transcript.appendToolResult(call.id(), call.name(), dispatcher.toJson(result));
            invocations.add(new ToolInvocation(call.id(), call.name(), call.argumentsJson(), result, result.durationMs()));
        }
        return invocations;
    }

    private ModelReply callProvider(ModelClient client, Transcript transcript, List<ToolSpec> tools, Duration remaining) {
        Duration timeout = min(props.getModelCallTimeout(), remaining);
        ModelCallRequest request = new ModelCallRequest(transcript.systemPrompt(), transcript.turns(), tools,
                props.getMaxTokens(), props.getTemperature());
        try {
            return executor.call(() -> client.complete(request), timeout);
        } catch (TimeoutException e) {
            throw new ProviderUnavailableException(client.name(),
                    "Provider " + client.name() + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderUnavailableException pue) {
                throw pue;
            }
            throw new ProviderUnavailableException(client.name(),
                    "Provider " + client.name() + " failed: " + (cause != null ? cause.getMessage() : e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(client.name(), "Interrupted while waiting for " + client.name(), e);
        }
    }

    /** Null when the run may continue, otherwise the reason to stop. */
    private OrchestrationOutcome checkStop(Instant budgetEnd, Instant callerDeadline) {
        if (Thread.currentThread().isInterrupted()) {
            return OrchestrationOutcome.CANCELLED;
        }
        Instant now = clock.instant();
        if (callerDeadline != null && !now.isBefore(callerDeadline)) {
            return OrchestrationOutcome.CANCELLED;
        }
        if (!now.isBefore(budgetEnd)) {
            return OrchestrationOutcome.TIME_BUDGET_EXHAUSTED;
        }
        return null;
    }

    private Duration remaining(Instant budgetEnd, Instant callerDeadline) {
        Instant end = callerDeadline != null && callerDeadline.isBefore(budgetEnd) ? callerDeadline : budgetEnd;
        Duration left = Duration.between(clock.instant(), end);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private void record(java.util.function.Consumer<ClassificationMetrics> action) {
        if (metrics != null) {
            action.accept(metrics);
        }
    }

    /** Mutable bookkeeping for one run. */
    private final class Run {
        private final Instant start;
        private final List<ToolCallRound> rounds = new ArrayList<>();
        private final List<ProviderFailure> failures = new ArrayList<>();
        private ModelClient active;
        private boolean switched;
        private String lastText = "";

        Run(Instant start, ModelClient active) {
            this.start = start;
            this.active = active;
        }

        OrchestrationResult finish(OrchestrationOutcome outcome, String text, ToolDispatcher dispatcher) {
            Duration elapsed = Duration.between(start, clock.instant());
            double costUsd = dispatcher.scope().totalCostUsd();
            log.info("Orchestration {} after {} round(s) on '{}' in {}ms (cost ${})", outcome, rounds.size(),
                    active.name(), elapsed.toMillis(), String.format("%.5f", costUsd));
            record(m -> m.recordOrchestration(outcome.name(), rounds.size()));
            return new OrchestrationResult(outcome, text, outcome == OrchestrationOutcome.FAILED ? null : active.name(),
                    switched, rounds, failures, dispatcher.invocationCounts(), costUsd, elapsed);
        }
    }
}
