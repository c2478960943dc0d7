package com.querygate.model;

import lombok.Getter;

import java.time.Instant;

/**
 * Fixed-window admission counter for one operation kind. Callers must hold the bucket's
 * monitor while calling the mutating methods.
 */
@Getter
public class RateLimitBucket {
    private final String operationKind;
    private final int windowLengthSeconds;
    private final int limit;
    private Instant windowStart;
    private int count;

    public RateLimitBucket(String operationKind, int limit, int windowLengthSeconds, Instant now) {
        this.operationKind = operationKind;
        this.limit = limit;
        this.windowLengthSeconds = windowLengthSeconds;
        this.windowStart = now;
        this.count = 0;
    }

    public boolean windowElapsed(Instant now) {
        return now.isAfter(windowStart.plusSeconds(windowLengthSeconds));
    }

    public void reset(Instant now) {
        this.windowStart = now;
        this.count = 0;
    }

    public boolean tryIncrement() {
        if (count >= limit) {
            return false;
        }
        count++;
        return true;
    }

    public long windowRemainingSeconds(Instant now) {
        long remaining = windowStart.plusSeconds(windowLengthSeconds).getEpochSecond() - now.getEpochSecond();
        return Math.max(0, remaining);
    }
}
