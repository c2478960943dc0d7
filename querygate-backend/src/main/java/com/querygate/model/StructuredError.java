package com.querygate.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Caller-facing failure description. Carries no stack traces, file paths or raw engine text.
 */
@Value
@Builder
public class StructuredError {
    ErrorKind kind;
    String message;
    @Singular
    List<String> suggestions;
}
