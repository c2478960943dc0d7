package com.querygate.error;

import com.querygate.model.ErrorKind;

import java.util.List;

/**
 * Generic engine or gateway failure that matches no other kind.
 */
public class InternalFaultException extends GatewayException {

    public InternalFaultException(String message, List<String> suggestions, Throwable cause) {
        super(ErrorKind.INTERNAL_ERROR, message, suggestions, cause);
    }
}
