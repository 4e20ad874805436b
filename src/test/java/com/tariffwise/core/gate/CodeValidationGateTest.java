package com.tariffwise.core.gate;

import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.CandidateSource;
import com.tariffwise.core.model.CandidateStatus;
import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.Confidence;
import com.tariffwise.core.model.GateResult;
import com.tariffwise.core.model.ProductLine;
import com.tariffwise.core.reference.InMemoryReferenceDataset;
import com.tariffwise.core.reference.ReferenceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeValidationGateTest {

    private CodeValidationGate gate;

    @BeforeEach
    void setUp() {
        var dataset = new InMemoryReferenceDataset(List.of(
                new ReferenceRecord("8516.71.0000", "Coffee or tea makers", "Free"),
                new ReferenceRecord("8516.72.0000", "Toasters", "Free"),
                new ReferenceRecord("8516.79.0000", "Other electro-thermic appliances", "12%"),
                new ReferenceRecord("8518.30.0000", "Headphones and earphones", "Free"),
                new ReferenceRecord("8471.30.0000", "Portable automatic data processing machines", "Free")));
        gate = new CodeValidationGate(dataset, new GateProperties());
    }

    private static GateContext contextWith(CandidateClassification... candidates) {
        var request = ClassificationRequest.of("Quote", List.of(ProductLine.of("item")));
        return new GateContext(request, List.of(candidates));
    }

    private static CandidateClassification candidate(String item, String code, Confidence confidence) {
        return new CandidateClassification(item, code, confidence, CandidateSource.MODEL, "");
    }

    @Test
    @DisplayName("exact match is marked valid with the canonical description")
    void exactMatchIsValid() {
        var candidate = candidate("laptop", "8471.30.0000", Confidence.HIGH);
        GateContext context = contextWith(candidate);

        GateResult result = gate.apply(context);

        assertTrue(result.passed());
        assertEquals(CandidateStatus.VALID, candidate.getStatus());
        assertEquals("8471300000", candidate.getCode());
        assertEquals("Portable automatic data processing machines", candidate.getReferenceDescription());
        assertEquals(Confidence.HIGH, candidate.getConfidence());
        assertFalse(candidate.isCorrected());
        assertTrue(context.blockingIssues().isEmpty());
    }

    @Test
    @DisplayName("unknown code is replaced by the best sibling under the same heading")
    void unknownCodeCorrectedToHeadingSibling() {
        var candidate = candidate("espresso coffee machine", "8516.75", Confidence.HIGH);
        GateContext context = contextWith(candidate);

        GateResult result = gate.apply(context);

        assertTrue(result.evaluated());
        assertTrue(result.passed());
        assertEquals(CandidateStatus.CORRECTED, candidate.getStatus());
        assertEquals("8516710000", candidate.getCode());
        assertEquals("8516.75", candidate.getOriginalCode());
        assertTrue(candidate.isCorrected());
        assertEquals(Confidence.MEDIUM, candidate.getConfidence());
        assertEquals("corrected", context.auditTrail().get(0).action());
        assertTrue(result.findings().get(0).startsWith("1 candidate(s) corrected"));
    }

    @Test
    @DisplayName("falls back to the chapter when the heading has no siblings")
    void fallsBackToChapterSibling() {
        var candidate = candidate("wireless headphones", "8599.10", Confidence.MEDIUM);

        gate.apply(contextWith(candidate));

        assertEquals(CandidateStatus.CORRECTED, candidate.getStatus());
        assertEquals("8518300000", candidate.getCode());
        assertEquals(Confidence.LOW, candidate.getConfidence());
    }

    @Test
    @DisplayName("code with no sibling in heading or chapter is flagged invalid, not dropped")
    void noSiblingIsFlaggedInvalid() {
        var candidate = candidate("mystery item", "9999.99", Confidence.HIGH);
        GateContext context = contextWith(candidate);

        GateResult result = gate.apply(context);

        assertFalse(result.passed());
        assertFalse(result.blocking());
        assertEquals(1, context.candidates().size());
        assertEquals(CandidateStatus.INVALID, candidate.getStatus());
        assertEquals(Confidence.LOW, candidate.getConfidence());
        assertEquals(1, context.blockingIssues().size());
        assertTrue(context.blockingIssues().get(0).contains("mystery item"));
    }

    @Test
    @DisplayName("candidate without a code is flagged invalid")
    void missingCodeIsInvalid() {
        var candidate = candidate("something", "", Confidence.MEDIUM);
        GateContext context = contextWith(candidate);

        gate.apply(context);

        assertEquals(CandidateStatus.INVALID, candidate.getStatus());
        assertFalse(context.blockingIssues().isEmpty());
    }

    @Test
    @DisplayName("running the gate twice leaves a corrected candidate unchanged")
    void secondPassIsIdempotent() {
        var candidate = candidate("espresso coffee machine", "8516.75", Confidence.HIGH);
        gate.apply(contextWith(candidate));

        gate.apply(contextWith(candidate));

        assertEquals("8516710000", candidate.getCode());
        assertEquals("8516.75", candidate.getOriginalCode());
        assertEquals(CandidateStatus.CORRECTED, candidate.getStatus());
        assertEquals(Confidence.MEDIUM, candidate.getConfidence());
    }

    @Test
    @DisplayName("shared prefix length counts leading equal characters")
    void sharedPrefixLength() {
        assertEquals(5, CodeValidationGate.sharedPrefixLength("851675", "8516710000"));
        assertEquals(0, CodeValidationGate.sharedPrefixLength("9", "8516"));
    }
}
