package com.janus.exception;

import org.springframework.http.HttpStatus;

/**
 * Stored credential file is malformed or failed authentication-tag verification.
 */
public class CredentialStoreException extends GatewayException {

    public CredentialStoreException(String message) {
        super("authentication_error", HttpStatus.UNAUTHORIZED, message);
    }

    public CredentialStoreException(String message, Throwable cause) {
        super("authentication_error", HttpStatus.UNAUTHORIZED, message, cause);
    }
}
