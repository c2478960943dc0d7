package com.querygate.engine;

/**
 * Model object collections reachable through the object-model interface.
 */
public enum ModelCollection {
    TABLES,
    COLUMNS,
    MEASURES,
    RELATIONSHIPS,
    EXPRESSIONS,
    DATA_SOURCES
}
