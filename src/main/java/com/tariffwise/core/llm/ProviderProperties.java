package com.tariffwise.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Primary and secondary provider selection.
 *
 * <pre>
 * tariffwise:
 *   providers:
 *     primary:
 *       name: gemini
 *       chat-model-bean: openAiChatModel
 *       model: gemini-2.5-flash
 *     secondary:
 *       name: claude
 *       chat-model-bean: anthropicChatModel
 *       model: claude-sonnet-4-20250514
 * </pre>
 *
 * Prices left unset fall back to {@link ModelCatalog}.
 */
@Component
@ConfigurationProperties(prefix = "tariffwise.providers")
public class ProviderProperties {

    private Provider primary = new Provider("gemini", "openAiChatModel", "gemini-2.5-flash");
    private Provider secondary = new Provider("claude", "anthropicChatModel", "claude-sonnet-4-20250514");

    public Provider getPrimary() {
        return primary;
    }

    public void setPrimary(Provider primary) {
        this.primary = primary;
    }

    public Provider getSecondary() {
        return secondary;
    }

    public void setSecondary(Provider secondary) {
        this.secondary = secondary;
    }

    public static class Provider {
        private boolean enabled = true;
        private String name;
        private String chatModelBean;
        private String model;
        private Double inputPricePerMillion;
        private Double outputPricePerMillion;

        public Provider() {}

        Provider(String name, String chatModelBean, String model) {
            this.name = name;
            this.chatModelBean = chatModelBean;
            this.model = model;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getChatModelBean() { return chatModelBean; }
        public void setChatModelBean(String chatModelBean) { this.chatModelBean = chatModelBean; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Double getInputPricePerMillion() { return inputPricePerMillion; }
        public void setInputPricePerMillion(Double inputPricePerMillion) { this.inputPricePerMillion = inputPricePerMillion; }
        public Double getOutputPricePerMillion() { return outputPricePerMillion; }
        public void setOutputPricePerMillion(Double outputPricePerMillion) { this.outputPricePerMillion = outputPricePerMillion; }

        /** Pricing from explicit properties, else from the catalog, else free. */
        public ModelCatalog.ModelInfo pricing() {
            var catalog = ModelCatalog.findModel(model);
            double in = inputPricePerMillion != null ? inputPricePerMillion
                    : catalog.map(ModelCatalog.ModelInfo::inputPricePer1M).orElse(0.0);
            double out = outputPricePerMillion != null ? outputPricePerMillion
                    : catalog.map(ModelCatalog.ModelInfo::outputPricePer1M).orElse(0.0);
            return new ModelCatalog.ModelInfo(model, name, catalog.map(ModelCatalog.ModelInfo::tier).orElse("custom"), in, out);
        }
    }
}
