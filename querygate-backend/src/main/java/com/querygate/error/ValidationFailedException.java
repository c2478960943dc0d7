package com.querygate.error;

import com.querygate.model.ErrorKind;

import java.util.List;

/**
 * Thrown when the input validator rejects a request.
 */
public class ValidationFailedException extends GatewayException {
    /**
     * Create a new exception.
     *
     * @param reason validator reason, safe to return to the caller
     */
    public ValidationFailedException(String reason) {
        super(ErrorKind.VALIDATION_FAILED, reason,
                List.of("Check the request parameters and try again"), null);
    }
}
