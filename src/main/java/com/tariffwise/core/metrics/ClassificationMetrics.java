package com.tariffwise.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the classification pipeline.
 */
@Service
public class ClassificationMetrics {

    private final MeterRegistry registry;

    public ClassificationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProviderCall(String provider, long ms, double costUsd) {
        Timer.builder("tariffwise.provider.duration")
                .tag("provider", provider)
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("tariffwise.provider.cost")
                .description("Provider cost per call in USD")
                .tag("provider", provider)
                .register(registry)
                .record(costUsd);
    }

    public void recordProviderFailure(String provider) {
        Counter.builder("tariffwise.provider.failures")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void recordProviderSwitch(String from, String to) {
        Counter.builder("tariffwise.provider.switches")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordToolInvocation(String tool, String status, long ms) {
        Timer.builder("tariffwise.tool.duration")
                .tag("tool", tool)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordOrchestration(String outcome, int rounds) {
        Counter.builder("tariffwise.orchestration.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        DistributionSummary.builder("tariffwise.orchestration.rounds")
                .register(registry)
                .record(rounds);
    }

    /**
     * @param result "passed", "flagged", "blocked" or "not_evaluated"
     */
    public void recordGate(String gate, String result) {
        Counter.builder("tariffwise.gate.evaluations")
                .tag("gate", gate)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("tariffwise.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordMemoryShortcut() {
        Counter.builder("tariffwise.memory.shortcuts")
                .description("Requests answered entirely from classification memory")
                .register(registry)
                .increment();
    }

    public void recordPayload(String status, long ms) {
        Counter.builder("tariffwise.classifications.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("tariffwise.classification.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
