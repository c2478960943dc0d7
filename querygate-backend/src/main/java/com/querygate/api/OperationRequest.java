package com.querygate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.querygate.model.QueryMode;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of one operation call. Which fields matter depends on the operation.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OperationRequest {
    private String text;
    private QueryMode mode;
    private Integer maxRows;
    private Integer runs;
    private boolean bypassCache;
    private Map<String, String> identifiers = new LinkedHashMap<>();
    private String exportPath;
}
