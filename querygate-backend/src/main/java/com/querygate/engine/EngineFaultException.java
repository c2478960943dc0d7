package com.querygate.engine;

import lombok.Getter;

/**
 * Generic engine failure. Not a reason to switch paths unless policy says so.
 */
@Getter
public class EngineFaultException extends EngineException {
    private final String sqlState;

    public EngineFaultException(String message) {
        this(message, null, null);
    }

    public EngineFaultException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }
}
