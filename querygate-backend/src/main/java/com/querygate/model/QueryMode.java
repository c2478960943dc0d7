package com.querygate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueryMode {
    AUTO,
    ANALYZE,
    PREVIEW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QueryMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return QueryMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
