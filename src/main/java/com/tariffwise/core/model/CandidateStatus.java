package com.tariffwise.core.model;

/**
 * Validation state of a candidate classification.
 */
public enum CandidateStatus {
    /** Not yet seen by the code validation gate. */
    UNVALIDATED,
    /** Exact match in the reference dataset. */
    VALID,
    /** Replaced by the best-scoring sibling code. */
    CORRECTED,
    /** No match and no sibling; flagged for a human. */
    INVALID,
    /** The code validation gate could not run; the code is unchecked. */
    UNVERIFIED
}
