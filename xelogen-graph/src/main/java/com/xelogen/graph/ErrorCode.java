package com.xelogen.graph;

/**
 * Construction error kinds raised by {@link GraphBuildException}. Each one is a programmer-facing
 * violation detected at the call that caused it; none is retried.
 */
public enum ErrorCode {
    UNKNOWN_NODE_TYPE,
    UNKNOWN_PORT,
    TYPE_MISMATCH,
    DUPLICATE_BINDING,
    NO_MATCHING_OUTPUT,
    NO_CONTENT_SLOT,
    CONTENT_TYPE_MISMATCH,
    NOT_AN_IMPULSE,
    NOT_A_BOOLEAN,
    NOT_A_LIST,
    MISSING_IMPULSE_INPUT,
    MISSING_IMPULSE_OUTPUT,
    UNSUPPORTED_COMBINATION,
    /** Else with no matching If at the current nesting level, or a second Else for the same If. */
    DANGLING_ELSE
}
