package com.querygate.gateway;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OperationMetricsTest {

    private SimpleMeterRegistry registry;
    private OperationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OperationMetrics(registry);
    }

    @Test
    void testCountsAndPercentiles() {
        for (int i = 100; i >= 1; i--) {
            metrics.record("run_query", Duration.ofMillis(i), i % 10 != 0, i <= 5);
        }

        Map<String, Object> entry = metrics.snapshot().get("run_query");

        assertEquals(100L, entry.get("calls"));
        assertEquals(10L, entry.get("failures"));
        assertEquals(5L, entry.get("cache_hits"));
        assertEquals(100.0, (double) entry.get("max_ms"), 0.01);
        assertEquals(50.5, (double) entry.get("mean_ms"), 0.01);

        double p50 = (double) entry.get("p50_ms");
        double p95 = (double) entry.get("p95_ms");
        double p99 = (double) entry.get("p99_ms");
        assertTrue(p50 >= 40 && p50 <= 60, "p50 was " + p50);
        assertTrue(p95 >= 85 && p95 <= 105, "p95 was " + p95);
        assertTrue(p50 <= p95 && p95 <= p99, entry.toString());
    }

    @Test
    void testMetersAreTaggedWithOperation() {
        metrics.record("run_query", Duration.ofMillis(5), true, false);
        metrics.record("list_tables", Duration.ofMillis(7), false, false);
        metrics.record("list_tables", Duration.ofMillis(3), true, true);

        assertEquals(1L, registry.get(OperationMetrics.CALLS).tag(OperationMetrics.OPERATION_TAG, "run_query").timer().count());
        assertEquals(2L, registry.get(OperationMetrics.CALLS).tag(OperationMetrics.OPERATION_TAG, "list_tables").timer().count());
        assertEquals(1.0, registry.get(OperationMetrics.FAILURES).tag(OperationMetrics.OPERATION_TAG, "list_tables").counter().count());
        assertNull(registry.find(OperationMetrics.FAILURES).tag(OperationMetrics.OPERATION_TAG, "run_query").counter());
    }

    @Test
    void testSnapshotIsSortedByOperation() {
        metrics.record("run_query", Duration.ofMillis(1), true, false);
        metrics.record("list_tables", Duration.ofMillis(1), true, false);

        Map<String, Map<String, Object>> snapshot = metrics.snapshot();

        assertEquals("[list_tables, run_query]", snapshot.keySet().toString());
        assertEquals(0L, snapshot.get("run_query").get("failures"));
        assertEquals(0L, snapshot.get("run_query").get("cache_hits"));
    }

    @Test
    void testEmptySnapshot() {
        assertTrue(metrics.snapshot().isEmpty());
    }
}
