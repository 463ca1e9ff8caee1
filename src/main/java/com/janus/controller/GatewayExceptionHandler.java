package com.janus.controller;

import com.janus.exception.GatewayException;
import com.janus.exception.UpstreamException;
import com.janus.model.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Renders every failure as the canonical error envelope.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final int MAX_UPSTREAM_DETAIL = 500;

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiError> handleGatewayException(GatewayException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage());
        } else {
            log.warn("Request rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(e.getStatus()).body(ApiError.of(e.getErrorType(), describe(e)));
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ApiError> handleInvalidRequest(Exception e) {
        String message = e instanceof ServerWebInputException input ? input.getReason() : e.getMessage();
        log.warn("Invalid request: {}", message);
        return ResponseEntity.badRequest().body(ApiError.of("invalid_request_error", message));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException e) {
        log.warn("Request failed with {}: {}", e.getStatusCode(), e.getReason());
        return ResponseEntity.status(e.getStatusCode())
                .body(ApiError.of("invalid_request_error", e.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("internal_error", "Internal server error"));
    }

    private static String describe(GatewayException e) {
        if (e instanceof UpstreamException upstream
                && upstream.getResponseBody() != null && !upstream.getResponseBody().isBlank()) {
            String body = upstream.getResponseBody();
            return e.getMessage() + ": " + (body.length() > MAX_UPSTREAM_DETAIL
                    ? body.substring(0, MAX_UPSTREAM_DETAIL) + "..."
                    : body);
        }
        return e.getMessage();
    }
}
