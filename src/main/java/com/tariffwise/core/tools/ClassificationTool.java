package com.tariffwise.core.tools;

import java.util.Map;

/**
 * A capability the model may call by name.
 * <p>
 * Implementations validate their own arguments (throwing {@link ToolArgumentException}) and
 * return a JSON-serializable map. Any other exception is reported to the model as a tool error.
 */
public interface ClassificationTool {

    /** Registry key, as the model sees it. */
    String name();

    String description();

    /** JSON schema for the arguments object. */
    String inputSchema();

    Map<String, Object> invoke(ToolArguments arguments, RequestScope scope);
}
