package com.tariffwise.core.llm;

/**
 * A tool invocation requested by the model.
 *
 * @param id            provider call id, echoed back with the result
 * @param name          requested tool name
 * @param argumentsJson raw JSON arguments as emitted by the model
 */
public record ToolCallRequest(String id, String name, String argumentsJson) {

    public ToolCallRequest {
        argumentsJson = argumentsJson == null || argumentsJson.isBlank() ? "{}" : argumentsJson;
    }
}
