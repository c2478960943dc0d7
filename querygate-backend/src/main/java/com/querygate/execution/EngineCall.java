package com.querygate.execution;

import com.querygate.engine.EngineException;

import java.util.concurrent.TimeoutException;

/**
 * A unit of engine work, as raced against a deadline and measured by the tracer.
 */
@FunctionalInterface
public interface EngineCall<T> {

    T call() throws EngineException, TimeoutException;
}
