package com.tariffwise.core.tools;

/** Uniform status of a tool invocation. */
public enum ToolResultStatus {
    OK,
    ERROR,
    NOT_FOUND,
    INVALID_ARGUMENTS,
    BUDGET_EXCEEDED,
    SKIPPED
}
