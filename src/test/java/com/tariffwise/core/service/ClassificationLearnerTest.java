package com.tariffwise.core.service;

import com.tariffwise.core.memory.ClassificationMemory;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.CandidateSource;
import com.tariffwise.core.model.Confidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ClassificationLearnerTest {

    private static CandidateClassification valid(String item, CandidateSource source) {
        var c = new CandidateClassification(item, "8516100000", Confidence.MEDIUM, source, "");
        c.markValid("8516100000", "Water heaters", "Free");
        return c;
    }

    @Test
    @DisplayName("only valid, uncorrected model candidates are remembered")
    void learnsOnlyConfirmedModelAnswers() {
        ClassificationMemory memory = mock(ClassificationMemory.class);
        var corrected = new CandidateClassification("espresso", "851675", Confidence.HIGH, CandidateSource.MODEL, "");
        corrected.correctTo("8516710000", "Coffee or tea makers", "Free", "sibling");
        var unvalidated = new CandidateClassification("toaster", "8516720000", Confidence.HIGH, CandidateSource.MODEL, "");

        int learned = new ClassificationLearner(memory).learn(List.of(
                valid("kettle", CandidateSource.MODEL), valid("cached", CandidateSource.MEMORY), corrected, unvalidated));

        assertEquals(1, learned);
        verify(memory).remember("kettle", "8516100000", "Water heaters", 0.75);
        verifyNoMoreInteractions(memory);
    }

    @Test
    @DisplayName("memory failures are logged, not thrown")
    void memoryFailureDoesNotPropagate() {
        ClassificationMemory memory = mock(ClassificationMemory.class);
        doThrow(new IllegalStateException("full")).when(memory).remember(anyString(), anyString(), any(), anyDouble());

        assertEquals(0, new ClassificationLearner(memory).learn(List.of(valid("kettle", CandidateSource.MODEL))));
    }
}
