package com.querygate.engine;

/**
 * The engine refused the request administratively (DMV access disabled, permission denied).
 */
public class EngineBlockedException extends EngineException {

    public EngineBlockedException(String message, Throwable cause) {
        super(message, cause);
    }
}
