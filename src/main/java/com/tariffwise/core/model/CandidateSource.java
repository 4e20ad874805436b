package com.tariffwise.core.model;

/** Where a candidate classification came from. */
public enum CandidateSource {
    MODEL,
    MEMORY
}
