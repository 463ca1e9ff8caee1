package com.janus.exception;

import org.springframework.http.HttpStatus;

import java.time.Duration;

/**
 * Outbound call exceeded its deadline.
 */
public class UpstreamTimeoutException extends GatewayException {

    private final String provider;

    public UpstreamTimeoutException(String provider, Duration timeout, Throwable cause) {
        super("timeout_error", HttpStatus.GATEWAY_TIMEOUT,
                provider + " request timed out after " + timeout.toSeconds() + "s", cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
