package com.tariffwise.core.service;

import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.ProductLine;
import com.tariffwise.core.orchestrator.OrchestrationPrompt;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a classification request into the system and user prompts for the tool loop.
 */
@Component
public class PromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are a customs tariff classification specialist. For each product line, determine the \
            most specific tariff code in the reference dataset.

            Use the tools before answering:
            - check_memory to see whether the product was classified before
            - search_reference to find candidate codes by keyword or code prefix
            - verify_code to confirm that a code exists before you propose it
            - assess_risk when origin or declared value look unusual

            Propose only codes you have verified. Do not tell the reader to consult anyone else.
            When you are done, answer with JSON only, in this shape:
            {"classifications": [{"item_description": "...", "hs_code": "8516.71.0000", \
            "confidence": "high|medium|low", "reasoning": "..."}], "synthesis": "short summary"}
            """;

    private final ClassificationProperties props;

    public PromptBuilder(ClassificationProperties props) {
        this.props = props;
    }

    public OrchestrationPrompt build(ClassificationRequest request, List<ProductLine> lines) {
        var sb = new StringBuilder();
        sb.append("Classify the following product line(s).\n\n");

        int shown = Math.min(lines.size(), props.getMaxPromptLines());
        for (int i = 0; i < shown; i++) {
            ProductLine line = lines.get(i);
            sb.append(i + 1).append(". ").append(line.description());
            if (line.quantity() != null) {
                sb.append(" | quantity: ").append(line.quantity());
            }
            if (line.declaredValue() != null) {
                sb.append(" | declared value: ").append(line.declaredValue().toPlainString());
            }
            if (line.declaredOrigin() != null && !line.declaredOrigin().isBlank()) {
                sb.append(" | origin: ").append(line.declaredOrigin());
            }
            sb.append('\n');
        }
        if (lines.size() > shown) {
            sb.append("(").append(lines.size() - shown).append(" further line(s) omitted)\n");
        }

        if (!request.context().isBlank()) {
            sb.append("\n## Context\n\n").append(request.context().strip()).append('\n');
        }
        if (!request.enrichment().isBlank()) {
            sb.append("\n## Pre-enrichment\n\n").append(request.enrichment().strip()).append('\n');
        }
        return new OrchestrationPrompt(SYSTEM_PROMPT, sb.toString());
    }
}
