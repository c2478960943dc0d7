package com.querygate.engine;

/**
 * The interface that received the request cannot express it.
 */
public class EngineUnsupportedException extends EngineException {

    public EngineUnsupportedException(String message) {
        super(message);
    }

    public EngineUnsupportedException(String message, Throwable cause) {
        super(message, cause);
    }
}
