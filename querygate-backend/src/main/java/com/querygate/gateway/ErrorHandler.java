package com.querygate.gateway;

import com.querygate.error.GatewayException;
import com.querygate.error.RateLimitedException;
import com.querygate.model.ErrorKind;
import com.querygate.model.ExecutionResult;
import com.querygate.model.StructuredError;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns any failure into a caller-safe {@link ExecutionResult}. Full detail goes to the log only.
 */
@Slf4j
public class ErrorHandler {
    private static final int MAX_MESSAGE_CHARS = 300;
    private static final Pattern WINDOWS_PATH = Pattern.compile("(?:[A-Za-z]:[\\\\/]|\\\\\\\\)[^\\s'\"]*");
    private static final Pattern UNIX_PATH = Pattern.compile("(?<![\\w.])/(?:[\\w.\\-]+/)+[\\w.\\-]*");
    private static final Pattern STACK_FRAME = Pattern.compile("\\s+at\\s+[\\w.$]+\\(.*");

    public ExecutionResult handle(String operation, Throwable failure) {
        if (failure instanceof GatewayException gatewayException) {
            logGatewayFailure(operation, gatewayException);
            return ExecutionResult.failure(operation, StructuredError.builder()
                    .kind(gatewayException.getKind())
                    .message(sanitize(gatewayException.getMessage()))
                    .suggestions(gatewayException.getSuggestions())
                    .build());
        }

        log.error("Unexpected failure in {}", operation, failure);
        return ExecutionResult.failure(operation, StructuredError.builder()
                .kind(ErrorKind.INTERNAL_ERROR)
                .message("An unexpected error occurred")
                .suggestions(List.of("Retry the operation", "Check server logs using the request trace id"))
                .build());
    }

    private void logGatewayFailure(String operation, GatewayException e) {
        switch (e.getKind()) {
            case VALIDATION_FAILED:
                log.info("Rejected {}: {}", operation, e.getMessage());
                break;
            case RATE_LIMITED:
                log.warn("Rate limited {} (retry after {}s)", operation, ((RateLimitedException) e).getRetryAfterSeconds());
                break;
            case INTERNAL_ERROR:
                log.error("{} failed: {}", operation, e.getMessage(), e.getCause());
                break;
            default:
                log.warn("{} failed with {}: {}", operation, e.getKind(), e.getMessage(), e.getCause());
        }
    }

    /**
     * Drop file paths, stack frames and anything after the first line, and cap the length.
     */
    static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return "Operation failed";
        }
        String out = message;
        int newline = out.indexOf('\n');
        if (newline >= 0) {
            out = out.substring(0, newline);
        }
        out = STACK_FRAME.matcher(out).replaceAll("");
        out = WINDOWS_PATH.matcher(out).replaceAll("<path>");
        out = UNIX_PATH.matcher(out).replaceAll("<path>");
        out = out.trim();
        if (out.length() > MAX_MESSAGE_CHARS) {
            out = out.substring(0, MAX_MESSAGE_CHARS) + "...";
        }
        return out;
    }
}
