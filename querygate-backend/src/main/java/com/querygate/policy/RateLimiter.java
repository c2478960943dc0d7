package com.querygate.policy;

import com.querygate.config.GatewayProperties;
import com.querygate.model.RateLimitBucket;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-operation-kind admission control.
 *
 * <p>Each kind owns one bucket guarded by its own monitor, so unrelated kinds never contend.
 * Rejected calls are not counted, and a bucket resets unconditionally once its window has
 * elapsed.
 */
@Slf4j
public class RateLimiter {

    private final Clock clock;
    private final boolean enabled;
    private final GatewayProperties.WindowStrategy strategy;
    private final int windowSeconds;
    private final int defaultLimit;
    private final Map<String, Integer> limits;

    private final Map<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();
    private final Map<String, SlidingLog> slidingLogs = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> rejections = new ConcurrentHashMap<>();

    public RateLimiter(GatewayProperties properties, Clock clock) {
        GatewayProperties.RateLimitConfig config = properties.getRateLimit();
        this.clock = clock;
        this.enabled = config.isEnabled();
        this.strategy = config.getStrategy() != null ? config.getStrategy() : GatewayProperties.WindowStrategy.FIXED;
        this.windowSeconds = config.getWindowSeconds();
        this.defaultLimit = config.getDefaultLimit();
        this.limits = config.getLimits() != null ? Map.copyOf(config.getLimits()) : Map.of();
        log.info("Rate limiter {}: strategy={}, window={}s, limits={}",
                enabled ? "enabled" : "disabled", strategy, windowSeconds, limits);
    }

    /**
     * Count one call against {@code operationKind}.
     *
     * @return true if the call is admitted
     */
    public boolean admit(String operationKind) {
        if (!enabled) {
            return true;
        }
        boolean admitted = strategy == GatewayProperties.WindowStrategy.SLIDING
                ? admitSliding(operationKind)
                : admitFixed(operationKind);
        if (!admitted) {
            rejections.computeIfAbsent(operationKind, k -> new AtomicLong()).incrementAndGet();
            log.warn("Rate limit exceeded for {}", operationKind);
        }
        return admitted;
    }

    private boolean admitFixed(String operationKind) {
        Instant now = clock.instant();
        RateLimitBucket bucket = buckets.computeIfAbsent(operationKind,
                k -> new RateLimitBucket(k, limitFor(k), windowSeconds, now));
        synchronized (bucket) {
            if (bucket.windowElapsed(now)) {
                bucket.reset(now);
            }
            return bucket.tryIncrement();
        }
    }

    private boolean admitSliding(String operationKind) {
        Instant now = clock.instant();
        SlidingLog slidingLog = slidingLogs.computeIfAbsent(operationKind, k -> new SlidingLog(limitFor(k)));
        synchronized (slidingLog) {
            slidingLog.evictBefore(now.minusSeconds(windowSeconds));
            if (slidingLog.admitted.size() >= slidingLog.limit) {
                return false;
            }
            slidingLog.admitted.addLast(now);
            return true;
        }
    }

    /**
     * Seconds until {@code operationKind} would admit again; zero when it admits now.
     */
    public long retryAfterSeconds(String operationKind) {
        Instant now = clock.instant();
        if (strategy == GatewayProperties.WindowStrategy.SLIDING) {
            SlidingLog slidingLog = slidingLogs.get(operationKind);
            if (slidingLog == null) {
                return 0;
            }
            synchronized (slidingLog) {
                slidingLog.evictBefore(now.minusSeconds(windowSeconds));
                if (slidingLog.admitted.size() < slidingLog.limit || slidingLog.admitted.isEmpty()) {
                    return 0;
                }
                Instant oldest = slidingLog.admitted.peekFirst();
                return Math.max(1, oldest.plusSeconds(windowSeconds).getEpochSecond() - now.getEpochSecond());
            }
        }
        RateLimitBucket bucket = buckets.get(operationKind);
        if (bucket == null) {
            return 0;
        }
        synchronized (bucket) {
            if (bucket.windowElapsed(now) || bucket.getCount() < bucket.getLimit()) {
                return 0;
            }
            return Math.max(1, bucket.windowRemainingSeconds(now));
        }
    }

    public int limitFor(String operationKind) {
        return limits.getOrDefault(operationKind, defaultLimit);
    }

    /**
     * Read-only view: operationKind to {count, limit, window_remaining_seconds, rejected}.
     */
    public Map<String, Map<String, Object>> snapshot() {
        Instant now = clock.instant();
        Map<String, Map<String, Object>> out = new TreeMap<>();
        buckets.forEach((kind, bucket) -> {
            synchronized (bucket) {
                boolean elapsed = bucket.windowElapsed(now);
                out.put(kind, entry(elapsed ? 0 : bucket.getCount(), bucket.getLimit(),
                        elapsed ? windowSeconds : bucket.windowRemainingSeconds(now), kind));
            }
        });
        slidingLogs.forEach((kind, slidingLog) -> {
            synchronized (slidingLog) {
                slidingLog.evictBefore(now.minusSeconds(windowSeconds));
                long remaining = slidingLog.admitted.isEmpty() ? windowSeconds
                        : Math.max(0, slidingLog.admitted.peekFirst().plusSeconds(windowSeconds).getEpochSecond() - now.getEpochSecond());
                out.put(kind, entry(slidingLog.admitted.size(), slidingLog.limit, remaining, kind));
            }
        });
        return Collections.unmodifiableMap(out);
    }

    private Map<String, Object> entry(int count, int limit, long remaining, String kind) {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("count", count);
        e.put("limit", limit);
        e.put("window_remaining_seconds", remaining);
        e.put("rejected", rejections.getOrDefault(kind, new AtomicLong()).get());
        return e;
    }

    private static final class SlidingLog {
        private final int limit;
        private final Deque<Instant> admitted = new ArrayDeque<>();

        private SlidingLog(int limit) {
            this.limit = limit;
        }

        private void evictBefore(Instant cutoff) {
            while (!admitted.isEmpty() && !admitted.peekFirst().isAfter(cutoff)) {
                admitted.pollFirst();
            }
        }
    }
}
