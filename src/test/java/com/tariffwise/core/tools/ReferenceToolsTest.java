package com.tariffwise.core.tools;

import com.tariffwise.core.memory.InMemoryClassificationMemory;
import com.tariffwise.core.reference.InMemoryReferenceDataset;
import com.tariffwise.core.reference.ReferenceDataset;
import com.tariffwise.core.reference.ReferenceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReferenceToolsTest {

    private final ReferenceDataset dataset = spy(new InMemoryReferenceDataset(List.of(
            new ReferenceRecord("8516.71.0000", "Coffee or tea makers", "Free"),
            new ReferenceRecord("8516.72.0000", "Toasters", "Free"),
            new ReferenceRecord("8518.30.0000", "Headphones and earphones", "Free"))));

    @Test
    @DisplayName("verify_code reports an existing code with its description")
    void verifyExisting() {
        var result = new VerifyCodeTool(dataset)
                .invoke(new ToolArguments(Map.of("code", "8516.71.0000")), RequestScope.of("r"));

        assertEquals(true, result.get("exists"));
        assertEquals("Coffee or tea makers", result.get("description"));
        assertEquals("8516.71.0000", result.get("code"));
    }

    @Test
    @DisplayName("verify_code lists nearby codes for an unknown code")
    void verifyMissing() {
        var result = new VerifyCodeTool(dataset)
                .invoke(new ToolArguments(Map.of("code", "8516.75")), RequestScope.of("r"));

        assertEquals(false, result.get("exists"));
        assertEquals(2, ((List<?>) result.get("nearby_codes")).size());
    }

    @Test
    @DisplayName("verify_code rejects non-numeric codes")
    void verifyRejectsGarbage() {
        var tool = new VerifyCodeTool(dataset);
        assertThrows(ToolArgumentException.class,
                () -> tool.invoke(new ToolArguments(Map.of("code", "abc")), RequestScope.of("r")));
    }

    @Test
    @DisplayName("lookups are cached within one request scope")
    void cachedPerRequest() {
        var tool = new VerifyCodeTool(dataset);
        RequestScope scope = RequestScope.of("r");

        tool.invoke(new ToolArguments(Map.of("code", "8516.71.0000")), scope);
        tool.invoke(new ToolArguments(Map.of("code", "8516710000")), scope);
        tool.invoke(new ToolArguments(Map.of("code", "8516710000")), RequestScope.of("other"));

        verify(dataset, times(2)).lookupByCode("8516710000");
    }

    @Test
    @DisplayName("search_reference by prefix and by keyword")
    void search() {
        var tool = new SearchReferenceTool(dataset);

        var byPrefix = tool.invoke(new ToolArguments(Map.of("code_prefix", "8516")), RequestScope.of("r"));
        var byQuery = tool.invoke(new ToolArguments(Map.of("query", "coffee")), RequestScope.of("r"));

        assertEquals(2, byPrefix.get("count"));
        assertEquals(1, byQuery.get("count"));
        assertThrows(ToolArgumentException.class,
                () -> tool.invoke(new ToolArguments(Map.of()), RequestScope.of("r")));
        assertThrows(ToolArgumentException.class,
                () -> tool.invoke(new ToolArguments(Map.of("query", "x", "limit", 500)), RequestScope.of("r")));
    }

    @Test
    @DisplayName("check_memory returns the remembered code")
    void checkMemory() {
        var memory = new InMemoryClassificationMemory(0.6);
        memory.remember("Portable espresso maker", "8516.71.0000", "Coffee or tea makers", 0.95);
        var tool = new CheckMemoryTool(memory);

        var hit = tool.invoke(new ToolArguments(Map.of("product_description", "portable  ESPRESSO maker")),
                RequestScope.of("r"));
        var miss = tool.invoke(new ToolArguments(Map.of("product_description", "garden hose")), RequestScope.of("r"));

        assertEquals(true, hit.get("found"));
        assertEquals("exact", hit.get("level"));
        assertEquals("8516.71.0000", hit.get("code"));
        assertEquals(false, miss.get("found"));
    }
}
