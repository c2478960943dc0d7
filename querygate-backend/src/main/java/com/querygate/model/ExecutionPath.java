package com.querygate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionPath {
    PRIMARY,
    FALLBACK,
    CACHE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
