package com.janus.exception;

import org.springframework.http.HttpStatus;

/**
 * Canonical request content that cannot be expressed in a provider schema.
 */
public class TranspilerException extends GatewayException {

    public TranspilerException(String message) {
        super("invalid_request_error", HttpStatus.BAD_REQUEST, message);
    }
}
