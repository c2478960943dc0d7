package com.querygate.error;

import com.querygate.model.ErrorKind;

import java.util.List;

/**
 * Thrown when the primary path refused a request and the object-model fallback failed too.
 */
public class FallbackExhaustedException extends GatewayException {

    public FallbackExhaustedException(String message, Throwable cause) {
        super(ErrorKind.FALLBACK_EXHAUSTED, message,
                List.of("The engine blocks this request on both interfaces",
                        "Try an equivalent INFO.* query or a narrower request"),
                cause);
    }
}
