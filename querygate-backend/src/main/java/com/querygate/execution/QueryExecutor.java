package com.querygate.execution;

import com.querygate.config.GatewayProperties;
import com.querygate.engine.DmvQueries;
import com.querygate.engine.EngineBlockedException;
import com.querygate.engine.EngineConnection;
import com.querygate.engine.EngineException;
import com.querygate.engine.EngineFaultException;
import com.querygate.engine.EngineTimeoutException;
import com.querygate.engine.EngineTraceSession;
import com.querygate.engine.EngineUnsupportedException;
import com.querygate.engine.ObjectModelRequest;
import com.querygate.error.FallbackExhaustedException;
import com.querygate.error.InternalFaultException;
import com.querygate.error.QueryTimeoutException;
import com.querygate.model.ExecutionPath;
import com.querygate.model.ExecutionResult;
import com.querygate.model.ExecutionTrace;
import com.querygate.model.PerformanceSummary;
import com.querygate.model.QueryRequest;
import com.querygate.model.TabularResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Runs a validated request on the primary path and, when the engine refuses it there, once on
 * the object-model path.
 *
 * <p>Blocked, unsupported and timed-out primary attempts switch paths; generic faults do so only
 * for operation kinds listed in {@code fallback-on-fault-kinds}. The fallback is never followed
 * by another primary attempt. Failures leave as {@link com.querygate.error.GatewayException}.
 */
@Slf4j
public class QueryExecutor {
    private final EngineConnection connection;
    private final PerformanceTracer tracer;
    private final DeadlineRunner deadlineRunner;
    private final ModeHandlers modeHandlers;
    private final ObjectModelTranslator translator;
    private final Set<String> fallbackOnFaultKinds;
    private final boolean autoEvaluate;

    public QueryExecutor(EngineConnection connection,
                         PerformanceTracer tracer,
                         DeadlineRunner deadlineRunner,
                         ModeHandlers modeHandlers,
                         ObjectModelTranslator translator,
                         GatewayProperties.ExecutionConfig config) {
        this.connection = connection;
        this.tracer = tracer;
        this.deadlineRunner = deadlineRunner;
        this.modeHandlers = modeHandlers;
        this.translator = translator;
        this.fallbackOnFaultKinds = config.getFallbackOnFaultKinds() == null ? Set.of()
                : Set.copyOf(config.getFallbackOnFaultKinds());
        this.autoEvaluate = config.isAutoEvaluate();
    }

    /**
     * @param request the validated request
     * @param text sanitized query text
     * @param timeout bound for each attempt
     */
    public ExecutionResult run(QueryRequest request, String text, Duration timeout) {
        ExecutionPlan plan = modeHandlers.plan(request, text);
        String prepared = autoEvaluate ? DmvQueries.prepareForExecution(text, plan.getRowLimit()) : text;
        log.debug("Executing {} (rows<={}, runs={}, analyzing={})",
                request.operationOrKind(), plan.getRowLimit(), plan.getRuns(), plan.isAnalyzing());

        if (plan.isAnalyzing()) {
            return analyze(request, text, prepared, plan, timeout);
        }
        try {
            Traced<TabularResult> traced = primary(prepared, plan, timeout);
            return shape(request, traced, ExecutionPath.PRIMARY);
        } catch (EngineException | TimeoutException e) {
            return recover(request, text, plan, timeout, e, true);
        }
    }

    /**
     * Repeated timed runs. The whole series shares one deadline; the fastest run is the
     * reported trace.
     */
    private ExecutionResult analyze(QueryRequest request, String text, String prepared, ExecutionPlan plan, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<ExecutionTrace> traces = new ArrayList<>(plan.getRuns());
        TabularResult last = null;
        try {
            for (int i = 0; i < plan.getRuns(); i++) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new QueryTimeoutException(timeout);
                }
                Traced<TabularResult> traced = primary(prepared, plan, Duration.ofNanos(remaining));
                traces.add(traced.getTrace());
                last = traced.getValue();
            }
        } catch (EngineException | TimeoutException e) {
            if (e instanceof TimeoutException && !traces.isEmpty()) {
                throw new QueryTimeoutException(timeout);
            }
            return recover(request, text, plan, timeout, e, traces.isEmpty());
        }

        ExecutionTrace fastest = traces.stream()
                .min(Comparator.comparingDouble(ExecutionTrace::getTotalMillis))
                .orElseThrow();
        return ExecutionResult.of(request.operationOrKind(), last, ExecutionPath.PRIMARY).toBuilder()
                .trace(fastest)
                .performance(PerformanceSummary.of(traces))
                .build();
    }

    private Traced<TabularResult> primary(String prepared, ExecutionPlan plan, Duration timeout)
            throws EngineException, TimeoutException {
        EngineTraceSession session = connection.traceSession().orElse(null);
        return tracer.measure(session, () -> deadlineRunner.callWithin(timeout,
                () -> connection.metadataClient().query(prepared, plan.getRowLimit(), timeout)));
    }

    private ExecutionResult recover(QueryRequest request, String text, ExecutionPlan plan, Duration timeout,
                                    Exception failure, boolean fallbackAllowed) {
        boolean timedOut = failure instanceof TimeoutException || failure instanceof EngineTimeoutException;
        boolean refused = failure instanceof EngineBlockedException || failure instanceof EngineUnsupportedException;
        boolean faultFallback = failure instanceof EngineFaultException
                && fallbackOnFaultKinds.contains(request.getOperationKind());

        if (fallbackAllowed && (timedOut || refused || faultFallback)) {
            log.info("Primary path failed for {} ({}), trying object model",
                    request.operationOrKind(), failure.getClass().getSimpleName());
            return fallback(request, text, plan, timeout, failure, timedOut);
        }
        if (timedOut) {
            throw new QueryTimeoutException(timeout);
        }
        log.warn("Primary path fault for {}: {}", request.operationOrKind(), failure.getMessage());
        throw new InternalFaultException("Query failed on the engine",
                DmvQueries.errorSuggestions(failure.getMessage()), failure);
    }

    private ExecutionResult fallback(QueryRequest request, String text, ExecutionPlan plan, Duration timeout,
                                     Exception primaryFailure, boolean primaryTimedOut) {
        Optional<ObjectModelRequest> translated = translator.translate(text, request.getIdentifiers());
        if (translated.isEmpty()) {
            if (primaryTimedOut) {
                throw new QueryTimeoutException(timeout);
            }
            throw new FallbackExhaustedException("Request was refused by the engine and has no object-model equivalent",
                    primaryFailure);
        }

        ObjectModelRequest modelRequest = translated.get();
        try {
            Traced<TabularResult> traced = tracer.measure(null, () -> deadlineRunner.callWithin(timeout,
                    () -> connection.objectModelClient().fetch(modelRequest, plan.getRowLimit())));
            log.info("Object-model fallback served {} ({} rows)", modelRequest.getCollection(), traced.getValue().rowCount());
            return shape(request, traced, ExecutionPath.FALLBACK);
        } catch (TimeoutException e) {
            throw new FallbackExhaustedException("Object-model fallback timed out", e);
        } catch (EngineException e) {
            throw new FallbackExhaustedException("Object-model fallback failed", e);
        }
    }

    private static ExecutionResult shape(QueryRequest request, Traced<TabularResult> traced, ExecutionPath path) {
        return ExecutionResult.of(request.operationOrKind(), traced.getValue(), path).toBuilder()
                .trace(traced.getTrace())
                .build();
    }
}
