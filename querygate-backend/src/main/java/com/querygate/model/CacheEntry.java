package com.querygate.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

@Getter
public class CacheEntry {
    private final String key;
    private final ExecutionResult value;
    private final Instant storedAt;
    private final long ttlSeconds;
    private volatile long lastAccess;

    public CacheEntry(String key, ExecutionResult value, Instant storedAt, long ttlSeconds, long accessSequence) {
        this.key = key;
        this.value = value;
        this.storedAt = storedAt;
        this.ttlSeconds = ttlSeconds;
        this.lastAccess = accessSequence;
    }

    /**
     * An entry is expired once its full TTL has elapsed; a zero or negative TTL never expires.
     */
    public boolean isExpired(Instant now) {
        if (ttlSeconds <= 0) {
            return false;
        }
        return !now.isBefore(storedAt.plusSeconds(ttlSeconds));
    }

    public Duration age(Instant now) {
        return Duration.between(storedAt, now);
    }

    public void touch(long accessSequence) {
        this.lastAccess = accessSequence;
    }
}
