package com.querygate.gateway;

import com.querygate.model.ExecutionResult;

import java.time.Duration;

/**
 * The part of an operation that talks to the engine. Runs under the engine lock.
 */
@FunctionalInterface
public interface EngineStage {

    /**
     * @param sanitizedText validator output for the request text
     * @param timeout time left for this stage
     */
    ExecutionResult run(String sanitizedText, Duration timeout);
}
