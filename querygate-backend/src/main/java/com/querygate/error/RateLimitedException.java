package com.querygate.error;

import com.querygate.model.ErrorKind;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when an operation kind has used up its admissions for the current window.
 */
@Getter
public class RateLimitedException extends GatewayException {
    private final long retryAfterSeconds;

    public RateLimitedException(String operationKind, long retryAfterSeconds) {
        super(ErrorKind.RATE_LIMITED,
                "Rate limit exceeded for " + operationKind,
                List.of("Wait " + retryAfterSeconds + " seconds before retrying",
                        "Use cached results where possible"),
                null);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
