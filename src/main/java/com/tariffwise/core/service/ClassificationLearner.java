package com.tariffwise.core.service;

import com.tariffwise.core.memory.ClassificationMemory;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.CandidateSource;
import com.tariffwise.core.model.CandidateStatus;
import com.tariffwise.core.model.Confidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Stores confirmed model classifications in memory after the gates have run.
 * Best-effort: a failure is logged and never reaches the caller.
 */
@Component
public class ClassificationLearner {

    private static final Logger log = LoggerFactory.getLogger(ClassificationLearner.class);

    private final ClassificationMemory memory;

    public ClassificationLearner(ClassificationMemory memory) {
        this.memory = memory;
    }

    /** @return number of candidates remembered */
    public int learn(List<CandidateClassification> candidates) {
        int learned = 0;
        for (CandidateClassification c : candidates) {
            if (c.getSource() != CandidateSource.MODEL || c.getStatus() != CandidateStatus.VALID || c.isCorrected()) {
                continue;
            }
            try {
                memory.remember(c.getItemDescription(), c.getCode(), c.getReferenceDescription(), score(c.getConfidence()));
                learned++;
            } catch (RuntimeException e) {
                log.warn("Could not remember classification for '{}': {}", c.getItemDescription(), e.getMessage());
            }
        }
        if (learned > 0) {
            log.info("Remembered {} classification(s)", learned);
        }
        return learned;
    }

    static double score(Confidence confidence) {
        return switch (confidence) {
            case HIGH -> 0.95;
            case MEDIUM -> 0.75;
            case LOW -> 0.5;
        };
    }
}
