package com.querygate.error;

import com.querygate.model.ErrorKind;

import java.util.List;

/**
 * Thrown when the engine connection is missing or no longer answers.
 */
public class NotConnectedException extends GatewayException {

    public NotConnectedException() {
        this("No active engine connection", null);
    }

    public NotConnectedException(String message, Throwable cause) {
        super(ErrorKind.NOT_CONNECTED, message,
                List.of("Use connect to establish a connection",
                        "Make sure the engine instance is running"),
                cause);
    }
}
