package com.querygate.gateway;

import com.querygate.engine.EngineConnection;
import com.querygate.engine.EngineException;
import com.querygate.error.InternalFaultException;
import com.querygate.error.NotConnectedException;
import com.querygate.error.QueryTimeoutException;
import com.querygate.error.RateLimitedException;
import com.querygate.error.ValidationFailedException;
import com.querygate.execution.DeadlineRunner;
import com.querygate.execution.QueryExecutor;
import com.querygate.model.ExecutionResult;
import com.querygate.model.OperationKind;
import com.querygate.model.QueryRequest;
import com.querygate.model.ValidationResult;
import com.querygate.policy.InputValidator;
import com.querygate.policy.QueryCache;
import com.querygate.policy.RateLimiter;
import com.querygate.policy.ToolTimeoutRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point for governed engine access.
 *
 * <p>Every request passes the same stages, and the first failing stage ends it:
 * validate, admit, check liveness, look up the cache, execute, store. Execution holds a fair
 * engine lock, so calls reach the engine one at a time in arrival order while validation,
 * admission and cache lookups run concurrently. Nothing thrown inside escapes:
 * {@link ErrorHandler} turns every failure into a result.
 */
@Slf4j
public class PolicyGateway {
    private final GatewayContext context;
    private final InputValidator validator;
    private final RateLimiter rateLimiter;
    private final QueryCache cache;
    private final ToolTimeoutRegistry timeouts;
    private final QueryExecutor executor;
    private final DeadlineRunner deadlineRunner;
    private final ErrorHandler errorHandler;
    private final OperationMetrics metrics;
    private final ReentrantLock engineLock = new ReentrantLock(true);

    public PolicyGateway(GatewayContext context,
                         InputValidator validator,
                         RateLimiter rateLimiter,
                         QueryCache cache,
                         ToolTimeoutRegistry timeouts,
                         QueryExecutor executor,
                         DeadlineRunner deadlineRunner,
                         ErrorHandler errorHandler,
                         OperationMetrics metrics) {
        this.context = context;
        this.validator = validator;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.timeouts = timeouts;
        this.executor = executor;
        this.deadlineRunner = deadlineRunner;
        this.errorHandler = errorHandler;
        this.metrics = metrics;
    }

    /**
     * Run a query-style request through the executor; successful results are cached unless the
     * request bypasses the cache.
     */
    public ExecutionResult execute(QueryRequest request) {
        return execute(request, true);
    }

    public ExecutionResult execute(QueryRequest request, boolean cacheable) {
        return execute(request, (text, timeout) -> executor.run(request, text, timeout), cacheable);
    }

    /**
     * Run {@code stage} under the full policy sequence.
     *
     * @param cacheable whether results may be served from and stored in the cache
     */
    public ExecutionResult execute(QueryRequest request, EngineStage stage, boolean cacheable) {
        String operation = request.operationOrKind();
        long started = System.nanoTime();
        ExecutionResult result;
        try {
            result = governed(request, stage, cacheable);
        } catch (RuntimeException e) {
            result = errorHandler.handle(operation, e);
        }
        record(operation, started, result);
        return result;
    }

    private ExecutionResult governed(QueryRequest request, EngineStage stage, boolean cacheable) {
        ValidationResult validation = validator.validate(request);
        if (!validation.isOk()) {
            throw new ValidationFailedException(validation.getReason());
        }

        String kind = request.getOperationKind();
        if (!rateLimiter.admit(kind)) {
            throw new RateLimitedException(kind, rateLimiter.retryAfterSeconds(kind));
        }

        if (!context.getConnection().isAlive()) {
            throw new NotConnectedException();
        }

        String key = null;
        if (cacheable && !request.isBypassCache()) {
            key = QueryCache.fingerprint(kind, validation.getSanitizedText(), request.getMaxRows(), request.getMode());
            Optional<ExecutionResult> hit = cache.lookup(key);
            if (hit.isPresent()) {
                log.debug("Cache hit for {} ({})", request.operationOrKind(), key);
                return hit.get().asCacheHit().toBuilder().operation(request.operationOrKind()).build();
            }
        } else if (request.isBypassCache()) {
            cache.recordBypass();
        }

        Duration timeout = timeouts.timeoutFor(kind);
        ExecutionResult result = underEngineLock(timeout, remaining -> stage.run(validation.getSanitizedText(), remaining));
        if (key != null && result.isSuccess()) {
            cache.store(key, result);
        }
        return result;
    }

    /**
     * Open the engine connection. Rate limited and bounded like any other operation, but not
     * subject to the liveness check.
     */
    public ExecutionResult connect() {
        String operation = OperationCatalog.CONNECT;
        long started = System.nanoTime();
        ExecutionResult result;
        try {
            if (!rateLimiter.admit(OperationKind.CONNECTION_ATTEMPT)) {
                throw new RateLimitedException(OperationKind.CONNECTION_ATTEMPT,
                        rateLimiter.retryAfterSeconds(OperationKind.CONNECTION_ATTEMPT));
            }
            Duration timeout = timeouts.timeoutFor(OperationKind.CONNECTION_ATTEMPT);
            EngineConnection connection = context.getConnection();
            result = underEngineLock(timeout, remaining -> {
                try {
                    deadlineRunner.callWithin(remaining, () -> {
                        connection.connect();
                        return Boolean.TRUE;
                    });
                } catch (TimeoutException e) {
                    throw new NotConnectedException("Connection attempt timed out", e);
                } catch (EngineException e) {
                    throw new NotConnectedException("Failed to connect to the engine", e);
                }
                return ExecutionResult.builder()
                        .success(true)
                        .operation(operation)
                        .details(statusDetails())
                        .build();
            });
        } catch (RuntimeException e) {
            result = errorHandler.handle(operation, e);
        }
        record(operation, started, result);
        return result;
    }

    public ExecutionResult disconnect() {
        engineLock.lock();
        try {
            context.getConnection().disconnect();
        } finally {
            engineLock.unlock();
        }
        return ExecutionResult.builder()
                .success(true)
                .operation("disconnect")
                .details(statusDetails())
                .build();
    }

    public boolean isConnected() {
        return context.getConnection().isAlive();
    }

    public Map<String, Object> statusDetails() {
        Map<String, Object> details = new LinkedHashMap<>(context.getConnection().describe());
        details.put("alive", context.getConnection().isAlive());
        return details;
    }

    /**
     * Read-only view of cache, rate-limit, timeout and per-operation call statistics.
     */
    public Map<String, Object> diagnostics() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cache", cache.stats());
        out.put("rate_limits", rateLimiter.snapshot());
        out.put("operations", metrics.snapshot());
        Map<String, Long> timeoutSeconds = new TreeMap<>();
        timeouts.all().forEach((kind, timeout) -> timeoutSeconds.put(kind, timeout.toSeconds()));
        out.put("timeouts_seconds", timeoutSeconds);
        out.put("default_timeout_seconds", timeouts.getDefaultTimeout().toSeconds());
        return out;
    }

    public boolean invalidate(String key) {
        return cache.invalidate(key);
    }

    public int invalidatePrefix(String prefix) {
        return cache.invalidatePrefix(prefix);
    }

    public Duration timeoutFor(String operationKind) {
        return timeouts.timeoutFor(operationKind);
    }

    public int rateLimitFor(String operationKind) {
        return rateLimiter.limitFor(operationKind);
    }

    public int flushCache() {
        return cache.clear();
    }

    private ExecutionResult underEngineLock(Duration timeout, LockedStage stage) {
        long waitStarted = System.nanoTime();
        boolean locked;
        try {
            locked = engineLock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalFaultException("Interrupted while waiting for the engine", List.of("Retry the operation"), e);
        }
        if (!locked) {
            log.warn("Engine busy for {} ms, giving up", timeout.toMillis());
            throw new QueryTimeoutException(timeout);
        }
        try {
            Duration remaining = timeout.minusNanos(System.nanoTime() - waitStarted);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new QueryTimeoutException(timeout);
            }
            return stage.run(remaining);
        } finally {
            engineLock.unlock();
        }
    }

    private void record(String operation, long started, ExecutionResult result) {
        metrics.record(operation, Duration.ofNanos(System.nanoTime() - started),
                result.isSuccess(), Boolean.TRUE.equals(result.getCached()));
    }

    @FunctionalInterface
    private interface LockedStage {
        ExecutionResult run(Duration remaining);
    }
}
