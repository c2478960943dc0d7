package com.querygate.engine;

/**
 * The driver gave up on the statement because its own query timeout elapsed.
 */
public class EngineTimeoutException extends EngineException {

    public EngineTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
