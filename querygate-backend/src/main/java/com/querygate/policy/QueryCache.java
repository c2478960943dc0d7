package com.querygate.policy;

import com.querygate.model.CacheEntry;
import com.querygate.model.ExecutionResult;
import com.querygate.model.QueryMode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Result cache with per-entry TTL and an entry-count bound.
 *
 * <p>Reads and writes of one key are atomic through the backing concurrent map; only a store
 * that finds the cache at capacity takes the eviction lock, which removes expired entries first
 * and otherwise the least recently used one.
 */
@Slf4j
public class QueryCache {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Clock clock;
    private final long defaultTtlSeconds;
    private final int maxSize;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Object evictionLock = new Object();
    private final AtomicLong accessSequence = new AtomicLong();

    // Statistics for diagnostics
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expiredRemovals = new AtomicLong();
    private final AtomicLong bypassed = new AtomicLong();

    public QueryCache(long defaultTtlSeconds, int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.maxSize = maxSize;
        this.clock = clock;
        log.info("Query cache initialized: ttl={}s, maxSize={}", defaultTtlSeconds, maxSize);
    }

    /**
     * Deterministic key for {@code (operationKind, normalizedText, maxRows, mode)}. The kind is
     * kept as a readable prefix so that one kind can be invalidated as a whole.
     */
    public static String fingerprint(String operationKind, String text, Integer maxRows, QueryMode mode) {
        String normalized = text == null ? "" : WHITESPACE.matcher(text.trim()).replaceAll(" ");
        String material = operationKind + "|" + normalized + "|" + (maxRows == null ? "" : maxRows)
                + "|" + (mode == null ? "" : mode.name().toLowerCase(Locale.ROOT));
        return operationKind + ":" + DigestUtils.sha256Hex(material);
    }

    public Optional<ExecutionResult> lookup(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            if (entries.remove(key, entry)) {
                expiredRemovals.incrementAndGet();
            }
            misses.incrementAndGet();
            return Optional.empty();
        }
        entry.touch(accessSequence.incrementAndGet());
        hits.incrementAndGet();
        return Optional.ofNullable(entry.getValue());
    }

    public void store(String key, ExecutionResult value) {
        store(key, value, defaultTtlSeconds);
    }

    /**
     * Insert or overwrite {@code key}; an overwrite restarts the TTL.
     */
    public void store(String key, ExecutionResult value, long ttlSeconds) {
        CacheEntry entry = new CacheEntry(key, value, clock.instant(), ttlSeconds, accessSequence.incrementAndGet());
        if (!entries.containsKey(key) && entries.size() >= maxSize) {
            synchronized (evictionLock) {
                while (entries.size() >= maxSize && !entries.containsKey(key)) {
                    if (!evictOne(key)) {
                        break;
                    }
                }
            }
        }
        entries.put(key, entry);
        if (entries.size() > maxSize) {
            synchronized (evictionLock) {
                while (entries.size() > maxSize) {
                    if (!evictOne(key)) {
                        break;
                    }
                }
            }
        }
    }

    public void recordBypass() {
        bypassed.incrementAndGet();
    }

    public boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    public int invalidatePrefix(String prefix) {
        int removed = 0;
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix) && entries.remove(key) != null) {
                removed++;
            }
        }
        log.info("Invalidated {} cache entries with prefix {}", removed, prefix);
        return removed;
    }

    public int clear() {
        int size = entries.size();
        entries.clear();
        log.info("Cache cleared ({} entries)", size);
        return size;
    }

    public int size() {
        return entries.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public Map<String, Object> stats() {
        long h = hits.get();
        long m = misses.get();
        double hitRate = h + m > 0 ? Math.round(h * 10000.0 / (h + m)) / 100.0 : 0.0;
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("size", entries.size());
        out.put("max_size", maxSize);
        out.put("ttl_seconds", defaultTtlSeconds);
        out.put("hits", h);
        out.put("misses", m);
        out.put("hit_rate", hitRate);
        out.put("bypassed", bypassed.get());
        out.put("evictions", evictions.get());
        out.put("expired_removals", expiredRemovals.get());
        return out;
    }

    // Caller holds evictionLock.
    private boolean evictOne(String protectedKey) {
        Instant now = clock.instant();
        String victim = null;
        long oldest = Long.MAX_VALUE;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (e.getKey().equals(protectedKey)) {
                continue;
            }
            if (e.getValue().isExpired(now)) {
                if (entries.remove(e.getKey(), e.getValue())) {
                    expiredRemovals.incrementAndGet();
                    return true;
                }
                continue;
            }
            if (e.getValue().getLastAccess() < oldest) {
                oldest = e.getValue().getLastAccess();
                victim = e.getKey();
            }
        }
        if (victim == null) {
            return false;
        }
        if (entries.remove(victim) != null) {
            evictions.incrementAndGet();
            log.debug("Evicted least recently used cache entry {}", victim);
        }
        return true;
    }
}
