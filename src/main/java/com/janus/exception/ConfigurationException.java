package com.janus.exception;

import org.springframework.http.HttpStatus;

/**
 * Required setting missing or left at an insecure placeholder. Raised during startup,
 * where it aborts the process.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super("configuration_error", HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
