package com.querygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Timing of one execution, split between engine-internal and client-observed time.
 *
 * <p>{@code engineMillis} is {@code null} when the engine exposed no trace; the trace is then
 * {@link #isPartial() partial}. When present, {@code engineMillis + clientMillis} equals
 * {@code totalMillis} within {@link #TOLERANCE_MILLIS}; the two clocks differ, so engine time
 * is clamped to the wall time before the client share is derived.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionTrace {
    public static final double TOLERANCE_MILLIS = 0.05;

    double totalMillis;
    Double engineMillis;
    double clientMillis;
    Double storageEngineMillis;
    Double formulaEngineMillis;
    Integer storageEngineQueries;
    String tracingMethod;
    @Singular
    List<TraceEvent> events;
    boolean cached;

    public boolean isPartial() {
        return engineMillis == null;
    }

    public static ExecutionTrace cachedMarker() {
        return ExecutionTrace.builder()
                .tracingMethod("cache")
                .cached(true)
                .build();
    }
}
