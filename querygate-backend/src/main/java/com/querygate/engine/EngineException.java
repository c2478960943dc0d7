package com.querygate.engine;

/**
 * Failure reported by the engine or by the transport in front of it.
 */
public abstract class EngineException extends Exception {

    protected EngineException(String message) {
        super(message);
    }

    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
