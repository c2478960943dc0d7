package com.querygate.engine;

import java.util.Map;
import java.util.Optional;

/**
 * The single long-lived connection to the engine. It may drop at any moment, so callers check
 * {@link #isAlive()} right before using it.
 */
public interface EngineConnection {

    void connect() throws EngineException;

    void disconnect();

    boolean isAlive();

    MetadataQueryClient metadataClient();

    ObjectModelClient objectModelClient();

    Optional<EngineTraceSession> traceSession();

    /**
     * Non-secret description for status output (no credentials).
     */
    Map<String, Object> describe();
}
