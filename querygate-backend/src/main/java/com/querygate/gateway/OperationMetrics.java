package com.querygate.gateway;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-operation call counts and latency percentiles, kept as meters tagged with the operation
 * name.
 */
public class OperationMetrics {
    public static final String CALLS = "querygate.operation.calls";
    public static final String FAILURES = "querygate.operation.failures";
    public static final String CACHE_HITS = "querygate.operation.cache_hits";
    public static final String OPERATION_TAG = "operation";

    private final MeterRegistry registry;

    public OperationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void record(String operation, Duration elapsed, boolean success, boolean cached) {
        Timer.builder(CALLS)
                .description("Gateway operation latency")
                .tag(OPERATION_TAG, operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(elapsed);
        if (!success) {
            Counter.builder(FAILURES).tag(OPERATION_TAG, operation).register(registry).increment();
        }
        if (cached) {
            Counter.builder(CACHE_HITS).tag(OPERATION_TAG, operation).register(registry).increment();
        }
    }

    /**
     * Diagnostics view read back from the registry, keyed by operation name.
     */
    public Map<String, Map<String, Object>> snapshot() {
        Map<String, Map<String, Object>> out = new TreeMap<>();
        for (Timer timer : registry.find(CALLS).timers()) {
            String operation = timer.getId().getTag(OPERATION_TAG);
            if (operation == null) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("calls", timer.count());
            entry.put("failures", count(FAILURES, operation));
            entry.put("cache_hits", count(CACHE_HITS, operation));
            entry.put("mean_ms", round(timer.mean(TimeUnit.MILLISECONDS)));
            entry.put("max_ms", round(timer.max(TimeUnit.MILLISECONDS)));
            for (ValueAtPercentile p : timer.takeSnapshot().percentileValues()) {
                entry.put(String.format(Locale.ROOT, "p%d_ms", Math.round(p.percentile() * 100)),
                        round(p.value(TimeUnit.MILLISECONDS)));
            }
            out.put(operation, entry);
        }
        return Collections.unmodifiableMap(out);
    }

    private long count(String name, String operation) {
        Counter counter = registry.find(name).tag(OPERATION_TAG, operation).counter();
        return counter == null ? 0L : (long) counter.count();
    }

    private static double round(double millis) {
        return Math.round(millis * 100.0) / 100.0;
    }
}
