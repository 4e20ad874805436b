package com.tariffwise.core.orchestrator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Budgets for the tool-calling loop.
 */
@Component
@ConfigurationProperties(prefix = "tariffwise.orchestrator")
public class OrchestratorProperties {

    private int maxRounds = 8;
    private Duration timeBudget = Duration.ofSeconds(120);
    private int maxToolsPerRound = 8;
    /** Upper bound for one provider call; shortened to the remaining budget. */
    private Duration modelCallTimeout = Duration.ofSeconds(60);
    /** Upper bound for one tool call; shortened to the remaining budget. */
    private Duration toolCallTimeout = Duration.ofSeconds(20);
    private int maxTokens = 4096;
    private double temperature = 0.3;

    public int getMaxRounds() { return maxRounds; }
    public void setMaxRounds(int maxRounds) { this.maxRounds = maxRounds; }
    public Duration getTimeBudget() { return timeBudget; }
    public void setTimeBudget(Duration timeBudget) { this.timeBudget = timeBudget; }
    public int getMaxToolsPerRound() { return maxToolsPerRound; }
    public void setMaxToolsPerRound(int maxToolsPerRound) { this.maxToolsPerRound = maxToolsPerRound; }
    public Duration getModelCallTimeout() { return modelCallTimeout; }
    public void setModelCallTimeout(Duration modelCallTimeout) { this.modelCallTimeout = modelCallTimeout; }
    public Duration getToolCallTimeout() { return toolCallTimeout; }
    public void setToolCallTimeout(Duration toolCallTimeout) { this.toolCallTimeout = toolCallTimeout; }
    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
}
