package com.querygate.error;

import com.querygate.model.ErrorKind;
import lombok.Getter;

import java.util.List;

/**
 * Terminal failure of one gateway request. The message is caller-safe; the cause is only logged.
 */
@Getter
public abstract class GatewayException extends RuntimeException {
    private final ErrorKind kind;
    private final List<String> suggestions;

    protected GatewayException(ErrorKind kind, String message, List<String> suggestions, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
