package com.tariffwise.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the JSON arguments object the model sent with a tool call.
 */
public final class ToolArguments {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ToolArguments parse(String json, ObjectMapper mapper) {
        if (json == null || json.isBlank()) {
            return new ToolArguments(Map.of());
        }
        try {
            return new ToolArguments(mapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new ToolArgumentException("Arguments are not a JSON object: " + e.getOriginalMessage(), e);
        }
    }

    public String requireText(String name) {
        return optionalText(name)
                .orElseThrow(() -> new ToolArgumentException("Missing required argument '" + name + "'"));
    }

    public Optional<String> optionalText(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().strip();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public int optionalInt(String name, int defaultValue, int min, int max) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        if (value instanceof Number n) {
            parsed = n.intValue();
        } else {
            try {
                parsed = Integer.parseInt(value.toString().strip());
            } catch (NumberFormatException e) {
                throw new ToolArgumentException("Argument '" + name + "' must be an integer", e);
            }
        }
        if (parsed < min || parsed > max) {
            throw new ToolArgumentException("Argument '" + name + "' must be between " + min + " and " + max);
        }
        return parsed;
    }

    public Optional<BigDecimal> optionalDecimal(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value.toString().strip().replace(",", "")));
        } catch (NumberFormatException e) {
            throw new ToolArgumentException("Argument '" + name + "' must be a number", e);
        }
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
