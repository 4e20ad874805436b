package com.tariffwise.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Builds the primary and secondary {@link ModelClient}s from the Spring AI chat model beans
 * named in {@link ProviderProperties}.
 */
@Configuration
public class ModelClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ModelClientConfig.class);

    @Bean
    public ModelProviders modelProviders(Map<String, ChatModel> chatModels, ProviderProperties props) {
        ModelClient primary = create(props.getPrimary(), chatModels);
        ModelClient secondary = create(props.getSecondary(), chatModels);
        if (primary == null && secondary == null) {
            throw new IllegalStateException("No chat model available; configured beans: "
                    + props.getPrimary().getChatModelBean() + ", " + props.getSecondary().getChatModelBean()
                    + "; available: " + chatModels.keySet());
        }
        if (primary == null) {
            log.warn("Primary provider unavailable; running with '{}' only", secondary.name());
            return new ModelProviders(secondary, null);
        }
        if (secondary == null) {
            log.warn("No secondary provider configured; provider failover disabled");
        }
        log.info("Providers: primary={} secondary={}", primary.name(), secondary != null ? secondary.name() : "none");
        return new ModelProviders(primary, secondary);
    }

    private static ModelClient create(ProviderProperties.Provider provider, Map<String, ChatModel> chatModels) {
        if (provider == null || !provider.isEnabled()) {
            return null;
        }
        ChatModel chatModel = chatModels.get(provider.getChatModelBean());
        if (chatModel == null) {
            log.warn("Chat model bean '{}' for provider '{}' not found (available: {})",
                    provider.getChatModelBean(), provider.getName(), chatModels.keySet());
            return null;
        }
        var pricing = provider.pricing();
        log.info("Provider '{}' -> {} ({})", provider.getName(), provider.getModel(), pricing.priceDisplay());
        return new SpringAiModelClient(provider.getName(), chatModel, pricing);
    }
}
