package com.tariffwise.core.gate;

import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.GateAuditEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state shared by the gates for one request. Single-threaded.
 */
public class GateContext {

    private final ClassificationRequest request;
    private final List<CandidateClassification> candidates;
    private final List<GateAuditEntry> auditTrail = new ArrayList<>();
    private final List<String> blockingIssues = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> phrasesFound = new ArrayList<>();

    private AttemptStatus attemptStatus;
    private String renderedText = "";
    private String cleanedText = "";

    public GateContext(ClassificationRequest request, List<CandidateClassification> candidates) {
        this.request = request;
        this.candidates = new ArrayList<>(candidates);
        this.attemptStatus = AttemptStatus.failOpen(null);
    }

    public void audit(String gate, String target, String action, String detail) {
        auditTrail.add(new GateAuditEntry(gate, target, action, detail));
    }

    public void addBlockingIssue(String issue) {
        blockingIssues.add(issue);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void addPhrasesFound(List<String> phrases) {
        for (String phrase : phrases) {
            if (!phrasesFound.contains(phrase)) {
                phrasesFound.add(phrase);
            }
        }
    }

    public ClassificationRequest request() { return request; }
    public List<CandidateClassification> candidates() { return candidates; }
    public List<GateAuditEntry> auditTrail() { return auditTrail; }
    public List<String> blockingIssues() { return blockingIssues; }
    public List<String> warnings() { return warnings; }
    public List<String> phrasesFound() { return phrasesFound; }

    public AttemptStatus attemptStatus() { return attemptStatus; }
    public void setAttemptStatus(AttemptStatus attemptStatus) { this.attemptStatus = attemptStatus; }

    public String renderedText() { return renderedText; }
    public void setRenderedText(String renderedText) { this.renderedText = renderedText == null ? "" : renderedText; }

    public String cleanedText() { return cleanedText; }
    public void setCleanedText(String cleanedText) { this.cleanedText = cleanedText == null ? "" : cleanedText; }
}
