package com.querygate.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A single caller request, created per call and consumed once.
 */
@Value
@Builder(toBuilder = true)
public class QueryRequest {
    String operation;

    @NonNull
    String operationKind;

    String text;

    @Builder.Default
    TextKind textKind = TextKind.QUERY;

    @Builder.Default
    QueryMode mode = QueryMode.AUTO;

    Integer maxRows;

    Integer runs;

    boolean bypassCache;

    @Singular
    Map<String, String> identifiers;

    String exportPath;

    public String operationOrKind() {
        return operation != null ? operation : operationKind;
    }
}
