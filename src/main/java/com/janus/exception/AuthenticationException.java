package com.janus.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing, rejected or unrefreshable provider credential. Recovery requires the operator
 * to run the login flow again.
 */
public class AuthenticationException extends GatewayException {

    public enum Reason {
        NO_CREDENTIAL,
        REFRESH_FAILED,
        AUTHORIZATION_FAILED
    }

    private final String provider;
    private final Reason reason;

    public AuthenticationException(String provider, Reason reason, String message) {
        super("authentication_error", HttpStatus.UNAUTHORIZED, message);
        this.provider = provider;
        this.reason = reason;
    }

    public AuthenticationException(String provider, Reason reason, String message, Throwable cause) {
        super("authentication_error", HttpStatus.UNAUTHORIZED, message, cause);
        this.provider = provider;
        this.reason = reason;
    }

    public static AuthenticationException noCredential(String provider) {
        return new AuthenticationException(provider, Reason.NO_CREDENTIAL,
                "No " + provider + " token found. Please run: janus auth " + provider);
    }

    public static AuthenticationException refreshFailed(String provider, Throwable cause) {
        return new AuthenticationException(provider, Reason.REFRESH_FAILED,
                "Token refresh failed. Please re-authenticate: janus auth " + provider, cause);
    }

    public String getProvider() {
        return provider;
    }

    public Reason getReason() {
        return reason;
    }
}
