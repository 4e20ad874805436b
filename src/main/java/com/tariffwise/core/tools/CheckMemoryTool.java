package com.tariffwise.core.tools;

import com.tariffwise.core.memory.ClassificationMemory;
import com.tariffwise.core.memory.MemoryHit;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@code check_memory}: looks a product description up in classification memory.
 */
@Component
public class CheckMemoryTool implements ClassificationTool {

    private final ClassificationMemory memory;

    public CheckMemoryTool(ClassificationMemory memory) {
        this.memory = memory;
    }

    @Override
    public String name() {
        return "check_memory";
    }

    @Override
    public String description() {
        return "Look up a product description in the memory of previously confirmed classifications. "
                + "Returns the remembered code with match level (exact or partial) and confidence.";
    }

    @Override
    public String inputSchema() {
        return """
                {"type":"object","properties":{"product_description":{"type":"string","description":"Product description to look up"}},"required":["product_description"]}
                """;
    }

    @Override
    public Map<String, Object> invoke(ToolArguments arguments, RequestScope scope) {
        String description = arguments.requireText("product_description");
        Optional<MemoryHit> hit = scope.cached("memory:" + ClassificationMemory.keyOf(description),
                () -> memory.lookup(description));
        Map<String, Object> result = new LinkedHashMap<>();
        if (hit.isEmpty()) {
            result.put("found", false);
            return result;
        }
        MemoryHit h = hit.get();
        result.put("found", true);
        result.put("level", h.level().name().toLowerCase(Locale.ROOT));
        result.put("code", h.code());
        result.put("reference_description", h.referenceDescription());
        result.put("confidence", h.confidence());
        return result;
    }
}
