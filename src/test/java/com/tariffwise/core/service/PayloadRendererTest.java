package com.tariffwise.core.service;

import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.CandidateSource;
import com.tariffwise.core.model.Confidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PayloadRendererTest {

    private final PayloadRenderer renderer = new PayloadRenderer();

    @Test
    @DisplayName("renders corrected candidates with their original code and duty rate")
    void rendersCorrected() {
        var candidate = new CandidateClassification("espresso coffee machine", "851675", Confidence.HIGH,
                CandidateSource.MODEL, "Heats water under pressure");
        candidate.correctTo("8516710000", "Coffee or tea makers", "Free", "sibling");

        String text = renderer.render(List.of(candidate), "One item.", AttemptStatus.allowed("k", 1, List.of()));

        assertTrue(text.startsWith("1. espresso coffee machine"));
        assertTrue(text.contains("Code: 8516.71.0000 - Coffee or tea makers"));
        assertTrue(text.contains("Corrected from 8516.75"));
        assertTrue(text.contains("Duty rate: Free"));
        assertTrue(text.contains("Confidence: medium"));
        assertTrue(text.endsWith("One item."));
    }

    @Test
    @DisplayName("invalid candidates are shown as not confirmed")
    void rendersInvalid() {
        var candidate = new CandidateClassification("mystery", "9999", Confidence.HIGH, CandidateSource.MODEL, "");
        candidate.markInvalid("no sibling");

        String text = renderer.render(List.of(candidate), "", null);

        assertTrue(text.contains("Code: 9999 (not confirmed: no sibling)"));
        assertTrue(text.contains("Confidence: low"));
    }

    @Test
    @DisplayName("escalation replaces the classification text")
    void rendersEscalation() {
        var candidate = new CandidateClassification("kettle", "8516100000", Confidence.HIGH, CandidateSource.MODEL, "");

        String text = renderer.render(List.of(candidate), "ignored",
                AttemptStatus.escalation("k", 3, List.of("8516100000", "8516790000")));

        assertEquals("This request has been escalated for manual review after 2 automated attempt(s). "
                + "Previously proposed codes: 8516.10.0000, 8516.79.0000.", text);
    }

    @Test
    @DisplayName("no candidates renders a no-classification line")
    void rendersEmpty() {
        assertEquals("No classification could be produced for this request.", renderer.render(List.of(), "", null));
    }
}
