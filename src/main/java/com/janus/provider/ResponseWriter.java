package com.janus.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.janus.exception.GatewayException;
import com.janus.model.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Writes canonical bodies and event streams to the reactive response.
 */
@Slf4j
@Component
public class ResponseWriter {

    private final ObjectMapper objectMapper;

    public ResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Mono<Void> writeJson(ServerHttpResponse response, HttpStatusCode status, Object body) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsBytes(body))
                .flatMap(bytes -> {
                    response.setStatusCode(status);
                    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
                });
    }

    /**
     * Stream events frame by frame, flushing after each one. Headers are committed with the first
     * frame, so a failure past that point is reported in-band as an {@code error} event.
     */
    public Mono<Void> writeEventStream(ServerHttpResponse response, Flux<StreamEvent> events, String provider) {
        eventStreamHeaders(response.getHeaders());
        DataBufferFactory buffers = response.bufferFactory();

        Flux<StreamEvent> guarded = events.onErrorResume(e -> {
            log.error("Stream from {} failed: {}", provider, e.getMessage());
            String type = e instanceof GatewayException gatewayException
                    ? gatewayException.getErrorType()
                    : "api_error";
            return Flux.just(StreamEvent.error(type, e.getMessage()));
        });

        return response.writeAndFlushWith(guarded.map(event ->
                Mono.just(buffers.wrap(event.toFrame().getBytes(StandardCharsets.UTF_8)))));
    }

    /**
     * Copy an upstream body byte for byte. An event stream that breaks off ends with an
     * {@code error} event.
     */
    public Mono<Void> relay(ServerHttpResponse response, HttpStatusCode status, MediaType contentType,
                            Flux<DataBuffer> body, String provider) {
        response.setStatusCode(status);
        if (contentType != null) {
            response.getHeaders().setContentType(contentType);
        }
        if (MediaType.TEXT_EVENT_STREAM.isCompatibleWith(contentType)) {
            eventStreamHeaders(response.getHeaders());
            DataBufferFactory buffers = response.bufferFactory();
            Flux<DataBuffer> guarded = body.onErrorResume(e -> {
                log.error("Relayed stream from {} failed: {}", provider, e.getMessage());
                StreamEvent error = StreamEvent.error("api_error", provider + " stream interrupted: " + e.getMessage());
                return Mono.just(buffers.wrap(error.toFrame().getBytes(StandardCharsets.UTF_8)));
            });
            return response.writeAndFlushWith(guarded.map(Mono::just));
        }
        return response.writeWith(body);
    }

    private static void eventStreamHeaders(HttpHeaders headers) {
        headers.setContentType(MediaType.TEXT_EVENT_STREAM);
        headers.setCacheControl("no-cache");
        headers.setConnection("keep-alive");
    }
}
