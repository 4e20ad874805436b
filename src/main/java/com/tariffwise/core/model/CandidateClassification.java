package com.tariffwise.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A proposed classification code for one product line.
 * <p>
 * Created by the response parser or from a memory hit, then updated in place by the
 * validation gates. The gate pipeline is the only writer once a candidate has been
 * handed to it, and it runs on a single thread.
 */
public class CandidateClassification {

    private final String itemDescription;
    private final CandidateSource source;
    private final String reasoning;

    private String code;
    private Confidence confidence;
    private String referenceDescription;
    private String dutyRate;
    private String originalCode;
    private boolean corrected;
    private CandidateStatus status = CandidateStatus.UNVALIDATED;
    private String statusReason;

    public CandidateClassification(String itemDescription, String code, Confidence confidence,
                                   CandidateSource source, String reasoning) {
        this.itemDescription = itemDescription == null ? "" : itemDescription;
        this.code = code == null ? "" : code.strip();
        this.confidence = confidence == null ? Confidence.LOW : confidence;
        this.source = source;
        this.reasoning = reasoning == null ? "" : reasoning;
    }

    public void markValid(String canonicalCode, String referenceDescription, String dutyRate) {
        this.code = canonicalCode;
        this.referenceDescription = referenceDescription;
        this.dutyRate = dutyRate;
        if (status != CandidateStatus.CORRECTED) {
            this.status = CandidateStatus.VALID;
            this.statusReason = "Code found in reference dataset";
        }
    }

    /**
     * Substitutes a sibling code, keeping the first rejected code as written in {@code originalCode}
     * and lowering confidence by one tier.
     */
    public void correctTo(String siblingCode, String referenceDescription, String dutyRate, String reason) {
        if (originalCode == null) {
            this.originalCode = this.code;
        }
        this.code = siblingCode;
        this.referenceDescription = referenceDescription;
        this.dutyRate = dutyRate;
        this.corrected = true;
        this.confidence = confidence.downgrade();
        this.status = CandidateStatus.CORRECTED;
        this.statusReason = reason;
    }

    public void markInvalid(String reason) {
        this.status = CandidateStatus.INVALID;
        this.confidence = Confidence.LOW;
        this.statusReason = reason;
    }

    public void markUnverified(String reason) {
        if (status == CandidateStatus.UNVALIDATED) {
            this.status = CandidateStatus.UNVERIFIED;
            this.statusReason = reason;
        }
    }

    /** True once the code validation gate has accepted or substituted the code. */
    public boolean isReleasable() {
        return status == CandidateStatus.VALID || status == CandidateStatus.CORRECTED;
    }

    public boolean hasCode() {
        return code != null && !code.isBlank();
    }

    @JsonProperty("item_description")
    public String getItemDescription() {
        return itemDescription;
    }

    public String getCode() {
        return code;
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public CandidateSource getSource() {
        return source;
    }

    public String getReasoning() {
        return reasoning;
    }

    @JsonProperty("reference_description")
    public String getReferenceDescription() {
        return referenceDescription;
    }

    @JsonProperty("duty_rate")
    public String getDutyRate() {
        return dutyRate;
    }

    @JsonProperty("original_code")
    public String getOriginalCode() {
        return originalCode;
    }

    public boolean isCorrected() {
        return corrected;
    }

    public CandidateStatus getStatus() {
        return status;
    }

    @JsonProperty("status_reason")
    public String getStatusReason() {
        return statusReason;
    }

    @Override
    public String toString() {
        return "CandidateClassification[" + itemDescription + " -> " + code + ", " + status + ", " + confidence + "]";
    }
}
