package com.querygate.model;

/**
 * How the {@code text} of a {@link QueryRequest} is interpreted by validation and execution.
 */
public enum TextKind {
    /** Analytical or DMV-style query text. */
    QUERY,
    /** A single table/column/measure name. */
    IDENTIFIER,
    /** A filesystem path. */
    PATH
}
