package com.janus.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for errors surfaced to gateway callers.
 * Each subclass carries the canonical error type and the HTTP status it maps to.
 */
public abstract class GatewayException extends RuntimeException {

    private final String errorType;
    private final HttpStatus status;

    protected GatewayException(String errorType, HttpStatus status, String message) {
        super(message);
        this.errorType = errorType;
        this.status = status;
    }

    protected GatewayException(String errorType, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.status = status;
    }

    public String getErrorType() {
        return errorType;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
