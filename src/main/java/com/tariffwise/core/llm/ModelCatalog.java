package com.tariffwise.core.llm;

import java.util.List;
import java.util.Optional;

/**
 * Static price list for the chat models the classification pipeline is run against.
 */
public final class ModelCatalog {

    private ModelCatalog() {}

    public record ModelInfo(
            String id,
            String provider,
            String tier,
            double inputPricePer1M,
            double outputPricePer1M
    ) {
        public double cost(long promptTokens, long completionTokens) {
            return (promptTokens * inputPricePer1M + completionTokens * outputPricePer1M) / 1_000_000.0;
        }

        public String priceDisplay() {
            return String.format("$%.2f / $%.2f per 1M tokens", inputPricePer1M, outputPricePer1M);
        }
    }

    public static final List<ModelInfo> MODELS = List.of(
            new ModelInfo("gemini-2.5-flash", "google", "fast", 0.15, 0.60),
            new ModelInfo("gemini-2.0-flash", "google", "fast", 0.10, 0.40),
            new ModelInfo("gpt-4o-mini", "openai", "fast", 0.15, 0.60),
            new ModelInfo("gpt-4o", "openai", "flagship", 2.50, 10.00),
            new ModelInfo("claude-sonnet-4-20250514", "anthropic", "flagship", 3.00, 15.00),
            new ModelInfo("claude-3-5-haiku-20241022", "anthropic", "fast", 0.80, 4.00)
    );

    public static Optional<ModelInfo> findModel(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        return MODELS.stream().filter(m -> m.id().equals(modelId)).findFirst();
    }
}
