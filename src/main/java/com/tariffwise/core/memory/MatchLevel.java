package com.tariffwise.core.memory;

/** How closely a memory entry matched a description. */
public enum MatchLevel {
    EXACT,
    PARTIAL
}
