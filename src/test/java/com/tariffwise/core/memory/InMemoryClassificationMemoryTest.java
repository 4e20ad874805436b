package com.tariffwise.core.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryClassificationMemoryTest {

    private final InMemoryClassificationMemory memory = new InMemoryClassificationMemory(0.6);

    @Test
    @DisplayName("exact lookup ignores case and extra whitespace")
    void exactHit() {
        memory.remember("Portable Espresso Maker", "8516.71.0000", "Coffee or tea makers", 0.95);

        MemoryHit hit = memory.lookup("  portable   espresso maker ").orElseThrow();

        assertEquals(MatchLevel.EXACT, hit.level());
        assertEquals("8516.71.0000", hit.code());
        assertTrue(hit.isShortcut(0.9));
        assertFalse(hit.isShortcut(0.96));
    }

    @Test
    @DisplayName("partial hits discount confidence by a fixed factor and never shortcut")
    void partialHit() {
        memory.remember("wireless bluetooth headphones", "8518.30.0000", "Headphones", 0.9);

        MemoryHit hit = memory.lookup("wireless bluetooth headphones black").orElseThrow();

        assertEquals(MatchLevel.PARTIAL, hit.level());
        assertEquals(0.9 * 0.75, hit.confidence(), 1e-9);
        assertFalse(hit.isShortcut(0.1));
    }

    @Test
    @DisplayName("partial discount does not depend on how large the overlap is")
    void partialDiscountIsFixed() {
        memory.remember("wireless bluetooth headphones black", "8518.30.0000", "Headphones", 0.8);

        MemoryHit hit = memory.lookup("wireless bluetooth headphones black foldable").orElseThrow();

        assertEquals(MatchLevel.PARTIAL, hit.level());
        assertEquals(0.8 * 0.75, hit.confidence(), 1e-9);
    }

    @Test
    @DisplayName("overlap below the threshold is a miss")
    void miss() {
        memory.remember("wireless bluetooth headphones", "8518.30.0000", "Headphones", 0.9);

        assertTrue(memory.lookup("garden hose").isEmpty());
        assertTrue(memory.lookup("").isEmpty());
    }

    @Test
    @DisplayName("entries without a code are not stored")
    void ignoresBlankCode() {
        memory.remember("thing", " ", null, 0.9);
        assertEquals(0, memory.size());
    }

    @Test
    @DisplayName("memory key is truncated to 50 characters")
    void keyTruncated() {
        String key = ClassificationMemory.keyOf("A".repeat(80));
        assertEquals(50, key.length());
        assertEquals("a".repeat(50), key);
    }

    @Test
    @DisplayName("bundled seed loads")
    void seed() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/memory/seed.json")) {
            memory.seed(in, new ObjectMapper());
        }
        assertEquals(5, memory.size());
        assertEquals("8516.71.0000", memory.lookup("portable espresso maker").orElseThrow().code());
    }
}
