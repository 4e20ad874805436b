package com.tariffwise.core.llm;

/**
 * Tool schema advertised to the model.
 *
 * @param name        registry name of the tool
 * @param description what the tool does, for the model
 * @param inputSchema JSON schema of the arguments object
 */
public record ToolSpec(String name, String description, String inputSchema) {}
