package com.querygate.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Raw rows returned by one engine path before they are shaped into an {@link ExecutionResult}.
 */
@Value
@Builder
public class TabularResult {
    @Singular
    List<ColumnDefinition> columns;
    @Singular
    List<Map<String, Object>> rows;
    boolean truncated;

    public int rowCount() {
        return rows.size();
    }
}
