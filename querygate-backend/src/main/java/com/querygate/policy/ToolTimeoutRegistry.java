package com.querygate.policy;

import com.querygate.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maximum wait per operation kind. Kinds without an entry get the default.
 */
@Slf4j
public class ToolTimeoutRegistry {
    private final Duration defaultTimeout;
    private final Map<String, Duration> timeouts;

    public ToolTimeoutRegistry(GatewayProperties properties) {
        GatewayProperties.TimeoutConfig config = properties.getTimeouts();
        this.defaultTimeout = config.getDefaultTimeout();
        Map<String, Duration> copy = new TreeMap<>();
        if (config.getPerKind() != null) {
            config.getPerKind().forEach((kind, timeout) -> {
                if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                    throw new IllegalArgumentException("Timeout must be positive for " + kind);
                }
                copy.put(kind, timeout);
            });
        }
        this.timeouts = Collections.unmodifiableMap(copy);
        log.info("Timeout registry initialized with {} kinds (default {})", timeouts.size(), defaultTimeout);
    }

    public Duration timeoutFor(String operationKind) {
        return timeouts.getOrDefault(operationKind, defaultTimeout);
    }

    public Map<String, Duration> all() {
        return timeouts;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }
}
