package com.tariffwise.core.service;

import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.ProductLine;
import com.tariffwise.core.orchestrator.OrchestrationPrompt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    @Test
    @DisplayName("lines carry quantity, value and origin; context and enrichment get their own sections")
    void buildsUserPrompt() {
        var line = new ProductLine("Portable espresso maker", 12, "Italy", new BigDecimal("89.90"));
        var request = new ClassificationRequest(null, "Quote", null, List.of(line),
                "Retail packaging", "Brand: Bialetti");

        OrchestrationPrompt prompt = new PromptBuilder(new ClassificationProperties()).build(request, request.lines());

        assertTrue(prompt.userPrompt().contains(
                "1. Portable espresso maker | quantity: 12 | declared value: 89.90 | origin: Italy"));
        assertTrue(prompt.userPrompt().contains("## Context\n\nRetail packaging"));
        assertTrue(prompt.userPrompt().contains("## Pre-enrichment\n\nBrand: Bialetti"));
        assertTrue(prompt.systemPrompt().contains("verify_code"));
    }

    @Test
    @DisplayName("lines beyond the configured maximum are summarized")
    void truncatesLines() {
        var props = new ClassificationProperties();
        props.setMaxPromptLines(2);
        List<ProductLine> lines = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            lines.add(ProductLine.of("item " + i));
        }
        var request = ClassificationRequest.of("Quote", lines);

        String user = new PromptBuilder(props).build(request, lines).userPrompt();

        assertTrue(user.contains("2. item 2"));
        assertFalse(user.contains("item 3"));
        assertTrue(user.contains("(3 further line(s) omitted)"));
        assertFalse(user.contains("## Context"));
    }
}
