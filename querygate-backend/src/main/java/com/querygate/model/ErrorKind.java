package com.querygate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorKind {
    NOT_CONNECTED,
    VALIDATION_FAILED,
    RATE_LIMITED,
    QUERY_TIMEOUT,
    FALLBACK_EXHAUSTED,
    INTERNAL_ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
