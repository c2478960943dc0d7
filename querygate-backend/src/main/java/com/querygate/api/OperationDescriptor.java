package com.querygate.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Catalog entry as listed by {@code GET /v1/operations}.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OperationDescriptor {
    private String name;
    private String operationKind;
    private String description;
    private long timeoutSeconds;
    private int rateLimitPerWindow;
}
