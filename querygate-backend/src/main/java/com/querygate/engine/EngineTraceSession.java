package com.querygate.engine;

import com.querygate.model.TraceEvent;

import java.util.List;

/**
 * Engine-side event capture around a single execution. Only one capture may be active at a
 * time; the gateway's engine lock guarantees that.
 */
public interface EngineTraceSession {

    void start() throws EngineException;

    /**
     * Stop the capture and return the events seen since {@link #start()}, in arrival order.
     */
    List<TraceEvent> stop() throws EngineException;

    /**
     * Short label reported as the trace's tracing method.
     */
    String method();
}
