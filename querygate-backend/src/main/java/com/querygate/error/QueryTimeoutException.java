package com.querygate.error;

import com.querygate.model.ErrorKind;

import java.time.Duration;
import java.util.List;

/**
 * Thrown when an execution attempt does not finish within its operation timeout.
 */
public class QueryTimeoutException extends GatewayException {

    public QueryTimeoutException(Duration timeout) {
        super(ErrorKind.QUERY_TIMEOUT,
                "Query did not complete within " + timeout.toMillis() + " ms",
                List.of("Reduce max_rows or add filters to narrow the query",
                        "Use preview mode for large tables"),
                null);
    }
}
