package com.tariffwise.core.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

@Configuration
public class MemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

    @Bean
    public ClassificationMemory classificationMemory(MemoryProperties props, ResourceLoader resourceLoader,
                                                     ObjectMapper objectMapper) throws IOException {
        var memory = new InMemoryClassificationMemory(props.getPartialThreshold());
        String seed = props.getSeedResource();
        if (seed == null || seed.isBlank()) {
            log.info("Classification memory starts empty (no seed configured)");
            return memory;
        }
        Resource resource = resourceLoader.getResource(seed);
        if (!resource.exists()) {
            log.warn("Memory seed {} not found; starting empty", seed);
            return memory;
        }
        try (InputStream in = resource.getInputStream()) {
            memory.seed(in, objectMapper);
        }
        return memory;
    }
}
