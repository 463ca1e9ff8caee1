package com.janus.exception;

import org.springframework.http.HttpStatus;

/**
 * Non-2xx answer from an upstream provider.
 */
public class UpstreamException extends GatewayException {

    private final String provider;
    private final int upstreamStatus;
    private final String responseBody;

    public UpstreamException(String provider, int upstreamStatus, String responseBody) {
        super("api_error", resolveStatus(upstreamStatus),
                provider + " API request failed with status " + upstreamStatus);
        this.provider = provider;
        this.upstreamStatus = upstreamStatus;
        this.responseBody = responseBody;
    }

    /**
     * The provider could not be reached or the exchange broke off before a status arrived.
     */
    public UpstreamException(String provider, String message, Throwable cause) {
        super("api_error", HttpStatus.BAD_GATEWAY, provider + " API request failed: " + message, cause);
        this.provider = provider;
        this.upstreamStatus = 0;
        this.responseBody = null;
    }

    private static HttpStatus resolveStatus(int upstreamStatus) {
        HttpStatus status = HttpStatus.resolve(upstreamStatus);
        return status != null && status.isError() ? status : HttpStatus.BAD_GATEWAY;
    }

    public String getProvider() {
        return provider;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
