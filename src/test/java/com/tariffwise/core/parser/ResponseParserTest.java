package com.tariffwise.core.parser;

import com.tariffwise.core.llm.LlmParseException;
import com.tariffwise.core.memory.MatchLevel;
import com.tariffwise.core.memory.MemoryHit;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.CandidateSource;
import com.tariffwise.core.model.Confidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();

    @Test
    @DisplayName("parses JSON inside a code fence")
    void fencedJson() {
        String raw = """
                Here is my answer:
                ```json
                {"classifications":[{"item_description":"espresso machine","hs_code":"8516.71.0000",
                  "confidence":"high","reasoning":"Electric coffee maker"}],
                 "synthesis":"One item classified."}
                ```
                """;

        ParsedPayload payload = parser.parseStrict(raw);

        assertEquals(1, payload.candidates().size());
        CandidateClassification c = payload.candidates().get(0);
        assertEquals("8516.71.0000", c.getCode());
        assertEquals("espresso machine", c.getItemDescription());
        assertEquals(Confidence.HIGH, c.getConfidence());
        assertEquals(CandidateSource.MODEL, c.getSource());
        assertEquals("One item classified.", payload.synthesis());
    }

    @Test
    @DisplayName("parses JSON embedded in prose with lenient syntax")
    void embeddedLenientJson() {
        String raw = "Result: {'items': [{'item': 'toaster', 'code': '8516.72', 'confidence': 0.7,},], } done";

        ParsedPayload payload = parser.parseStrict(raw);

        assertEquals("8516.72", payload.candidates().get(0).getCode());
        assertEquals(Confidence.MEDIUM, payload.candidates().get(0).getConfidence());
    }

    @Test
    @DisplayName("parses a bare array and Hebrew confidence labels")
    void bareArray() {
        ParsedPayload payload = parser.parseStrict(
                "[{\"description\":\"מכונת קפה\",\"tariff_code\":\"8516710000\",\"confidence\":\"גבוהה\"}]");

        assertEquals(Confidence.HIGH, payload.candidates().get(0).getConfidence());
    }

    @Test
    @DisplayName("salvages complete objects from truncated output")
    void truncatedOutput() {
        String raw = "{\"classifications\":[{\"item\":\"kettle\",\"code\":\"8516.10\"},{\"item\":\"toaster\",\"code\":\"85";

        ParsedPayload payload = parser.parseStrict(raw);

        assertEquals(1, payload.candidates().size());
        assertEquals("8516.10", payload.candidates().get(0).getCode());
    }

    @Test
    @DisplayName("strict parse fails on prose; lenient parse returns empty")
    void prose() {
        assertThrows(LlmParseException.class, () -> parser.parseStrict("I could not find anything useful."));
        assertThrows(LlmParseException.class, () -> parser.parseStrict("  "));
        assertTrue(parser.parse("I could not find anything useful.").isEmpty());
    }

    @Test
    @DisplayName("memory hits replace the model's candidate for the same item and fill gaps")
    void mergeMemory() {
        ParsedPayload parsed = parser.parse("""
                {"classifications":[{"item":"Portable espresso maker","code":"8516.79","confidence":"low"},
                                    {"item":"steel bolts","code":"7318.15","confidence":"medium"}]}
                """);
        List<MemoryHit> hits = List.of(
                new MemoryHit("portable espresso maker", "portable espresso maker", "8516.71.0000",
                        "Coffee or tea makers", 0.95, MatchLevel.EXACT),
                new MemoryHit("cotton t-shirt", "cotton t-shirt", "6109.10.0000", "T-shirts", 0.92, MatchLevel.EXACT));

        ParsedPayload merged = parser.merge(parsed, hits);

        assertEquals(3, merged.candidates().size());
        assertEquals("8516.71.0000", merged.candidates().get(0).getCode());
        assertEquals(CandidateSource.MEMORY, merged.candidates().get(0).getSource());
        assertEquals(Confidence.HIGH, merged.candidates().get(0).getConfidence());
        assertEquals("7318.15", merged.candidates().get(1).getCode());
        assertEquals("6109.10.0000", merged.candidates().get(2).getCode());
    }

    @Test
    @DisplayName("a hit for a shorter description does not replace a different line containing it")
    void mergeKeepsDistinctLines() {
        String raw = """
                {"classifications":[{"item":"usb cable charger","code":"8504.40.00","confidence":"high"}]}
                """;
        List<MemoryHit> hits = List.of(
                new MemoryHit("cable", "cable", "8544.42.00", "Insulated conductors", 0.93, MatchLevel.EXACT));

        ParsedPayload merged = parser.parse(raw, hits);

        assertEquals(2, merged.candidates().size());
        assertEquals("usb cable charger", merged.candidates().get(0).getItemDescription());
        assertEquals("8504.40.00", merged.candidates().get(0).getCode());
        assertEquals(CandidateSource.MODEL, merged.candidates().get(0).getSource());
        assertEquals("cable", merged.candidates().get(1).getItemDescription());
        assertEquals(CandidateSource.MEMORY, merged.candidates().get(1).getSource());
    }

    @Test
    @DisplayName("two hits for the same description do not claim the same candidate")
    void mergeDoesNotReuseCandidate() {
        String raw = """
                {"classifications":[{"item":"Steel bolts","code":"7318.15","confidence":"low"}]}
                """;
        List<MemoryHit> hits = List.of(
                new MemoryHit("steel bolts", "steel bolts", "7318.15.0000", "Screws and bolts", 0.95, MatchLevel.EXACT),
                new MemoryHit("steel bolts", "steel bolts", "7318.16.0000", "Nuts", 0.91, MatchLevel.EXACT));

        ParsedPayload merged = parser.parse(raw, hits);

        assertEquals(2, merged.candidates().size());
        assertEquals("7318.15.0000", merged.candidates().get(0).getCode());
        assertEquals("7318.16.0000", merged.candidates().get(1).getCode());
    }
}
