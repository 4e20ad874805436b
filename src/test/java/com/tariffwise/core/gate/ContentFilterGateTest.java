package com.tariffwise.core.gate;

import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.GateResult;
import com.tariffwise.core.model.ProductLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentFilterGateTest {

    private final ContentFilterGate gate = new ContentFilterGate(new GateProperties());

    @Test
    @DisplayName("English disallowed phrase is replaced with the English replacement")
    void replacesEnglishPhrase() {
        var outcome = gate.filter("Code 8516.71.0000 fits. Please consult a licensed customs broker before import.");

        assertTrue(outcome.wasModified());
        assertEquals(List.of("consult a licensed customs broker"), outcome.phrasesFound());
        assertFalse(outcome.cleanedText().contains("customs broker"));
        assertTrue(outcome.cleanedText().contains("For further details, contact our classification team."));
        assertTrue(outcome.cleanedText().startsWith("Code 8516.71.0000 fits."));
    }

    @Test
    @DisplayName("matching ignores case")
    void caseInsensitive() {
        var outcome = gate.filter("UNABLE TO CLASSIFY this item.");

        assertTrue(outcome.wasModified());
        assertEquals(List.of("unable to classify"), outcome.phrasesFound());
    }

    @Test
    @DisplayName("Hebrew phrase gets the Hebrew replacement")
    void replacesHebrewPhrase() {
        var outcome = gate.filter("הסיווג הוא 8516.71. מומלץ לפנות לעמיל מכס.");

        assertTrue(outcome.wasModified());
        assertTrue(outcome.cleanedText().contains("לפרטים נוספים, פנו לצוות הסיווג שלנו."));
        assertFalse(outcome.cleanedText().contains("עמיל מכס"));
    }

    @Test
    @DisplayName("text without disallowed phrases is returned unchanged")
    void cleanTextUnchanged() {
        String text = "1. 8516.71.0000 Coffee or tea makers (confidence: high)";

        var outcome = gate.filter(text);

        assertFalse(outcome.wasModified());
        assertEquals(text, outcome.cleanedText());
        assertTrue(outcome.phrasesFound().isEmpty());
    }

    @Test
    @DisplayName("additional phrases from configuration are filtered too")
    void additionalPhrases() {
        var props = new GateProperties();
        props.getContentFilter().setAdditionalPhrases(List.of("ask your forwarder"));
        var configured = new ContentFilterGate(props);

        assertTrue(configured.filter("Otherwise ask your forwarder.").wasModified());
    }

    @Test
    @DisplayName("apply flags the gate and records phrases in the context")
    void applyRecordsPhrases() {
        var context = new GateContext(ClassificationRequest.of("s", List.of(ProductLine.of("x"))), List.of());
        context.setRenderedText("I'm not sure about this one.");

        GateResult result = gate.apply(context);

        assertTrue(result.evaluated());
        assertFalse(result.passed());
        assertEquals(List.of("I'm not sure"), context.phrasesFound());
        assertEquals("replaced_phrase", context.auditTrail().get(0).action());
        assertNotEquals(context.renderedText(), context.cleanedText());
    }
}
