package com.querygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Uniform response for every gateway operation. {@code success} is always present; a failed
 * result carries only {@code error}.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResult {
    boolean success;
    String operation;
    List<ColumnDefinition> columns;
    List<Map<String, Object>> rows;
    Integer rowCount;
    Boolean truncated;
    ExecutionTrace trace;
    PerformanceSummary performance;
    ExecutionPath path;
    Boolean cached;
    Map<String, Object> details;
    StructuredError error;

    public static ExecutionResult failure(String operation, StructuredError error) {
        return ExecutionResult.builder()
                .success(false)
                .operation(operation)
                .error(error)
                .build();
    }

    public static ExecutionResult of(String operation, TabularResult tabular, ExecutionPath path) {
        return ExecutionResult.builder()
                .success(true)
                .operation(operation)
                .columns(tabular.getColumns())
                .rows(tabular.getRows())
                .rowCount(tabular.rowCount())
                .truncated(tabular.isTruncated())
                .path(path)
                .cached(false)
                .build();
    }

    /**
     * Same payload as served from the cache: the engine was not contacted, so no fresh trace.
     */
    public ExecutionResult asCacheHit() {
        return toBuilder()
                .path(ExecutionPath.CACHE)
                .cached(true)
                .trace(ExecutionTrace.cachedMarker())
                .performance(null)
                .build();
    }
}
