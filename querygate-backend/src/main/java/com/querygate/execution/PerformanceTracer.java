package com.querygate.execution;

import com.querygate.engine.EngineException;
import com.querygate.engine.EngineTraceSession;
import com.querygate.model.TraceEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Measures one engine call: wall time always, engine time when a trace session is available.
 *
 * <p>Trace start or stop failures are logged and leave a partial trace; they never fail the
 * measured call.
 */
@Slf4j
public class PerformanceTracer {
    static final String WALL_CLOCK = "wall_clock";

    public <T> Traced<T> measure(EngineTraceSession session, EngineCall<T> call) throws EngineException, TimeoutException {
        boolean tracing = session != null && start(session);
        long started = System.nanoTime();
        T value;
        try {
            value = call.call();
        } catch (EngineException | TimeoutException | RuntimeException e) {
            if (tracing) {
                stop(session);
            }
            throw e;
        }
        double wallMillis = (System.nanoTime() - started) / 1_000_000.0;

        List<TraceEvent> events = tracing ? stop(session) : null;
        String method = events != null ? session.method() : WALL_CLOCK;
        return new Traced<>(value, TraceEventDecomposer.decompose(wallMillis, events, method));
    }

    private boolean start(EngineTraceSession session) {
        try {
            session.start();
            return true;
        } catch (EngineException | RuntimeException e) {
            log.warn("Engine trace unavailable, falling back to wall clock: {}", e.getMessage());
            return false;
        }
    }

    private List<TraceEvent> stop(EngineTraceSession session) {
        try {
            return session.stop();
        } catch (EngineException | RuntimeException e) {
            log.warn("Failed to collect engine trace events: {}", e.getMessage());
            return null;
        }
    }
}
