package com.janus.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.janus.auth.OAuthCredentialManager;
import com.janus.config.JanusProperties;
import com.janus.exception.GatewayException;
import com.janus.exception.UpstreamException;
import com.janus.exception.UpstreamTimeoutException;
import com.janus.model.MessagesRequest;
import com.janus.model.MessagesResponse;
import com.janus.model.StreamEvent;
import com.janus.transpiler.ProtocolTranspiler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;

/**
 * Base class for adapters backed by an OAuth-authenticated provider and a protocol transpiler.
 */
@Slf4j
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected final WebClient webClient;
    protected final JanusProperties.ProviderConfig config;
    protected final OAuthCredentialManager credentials;
    protected final ProtocolTranspiler transpiler;
    protected final ResponseWriter responseWriter;
    private final String name;

    protected AbstractProviderAdapter(String name,
                                      WebClient webClient,
                                      JanusProperties properties,
                                      OAuthCredentialManager credentials,
                                      ProtocolTranspiler transpiler,
                                      ResponseWriter responseWriter) {
        this.name = name;
        this.webClient = webClient;
        this.config = properties.provider(name);
        this.credentials = credentials;
        this.transpiler = transpiler;
        this.responseWriter = responseWriter;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public Mono<Void> handle(MessagesRequest request, ServerWebExchange exchange) {
        log.info("Routing model {} to {} (stream={})", request.getModel(), name, request.isStreaming());

        if (request.isStreaming()) {
            return stream(request)
                    .flatMap(events -> responseWriter.writeEventStream(exchange.getResponse(), events, name));
        }
        return complete(request)
                .flatMap(response -> responseWriter.writeJson(exchange.getResponse(), HttpStatus.OK, response));
    }

    /**
     * Non-streaming round trip.
     */
    public Mono<MessagesResponse> complete(MessagesRequest request) {
        String providerModel = transpiler.mapModel(request.getModel());

        return credentials.getValidToken()
                .flatMap(token -> buildBody(request, providerModel, token)
                        .flatMap(body -> webClient.post()
                                .uri(endpoint(providerModel, false))
                                .headers(headers -> applyHeaders(headers, token))
                                .contentType(MediaType.APPLICATION_JSON)
                                .bodyValue(body)
                                .retrieve()
                                .onStatus(HttpStatusCode::isError, this::upstreamError)
                                .bodyToMono(JsonNode.class)
                                .timeout(config.getTimeout())
                                .onErrorMap(this::translateError)))
                .map(body -> transpiler.convertResponse(body, request.getModel()))
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", name));
    }

    /**
     * Streaming round trip. The returned Mono completes once the provider has answered with a
     * success status; errors before that point are signalled on the Mono, later ones on the Flux.
     */
    public Mono<Flux<StreamEvent>> stream(MessagesRequest request) {
        String providerModel = transpiler.mapModel(request.getModel());

        return credentials.getValidToken()
                .flatMap(token -> buildBody(request, providerModel, token)
                        .flatMap(body -> webClient.post()
                                .uri(endpoint(providerModel, true))
                                .headers(headers -> applyHeaders(headers, token))
                                .contentType(MediaType.APPLICATION_JSON)
                                .accept(MediaType.TEXT_EVENT_STREAM)
                                .bodyValue(body)
                                .retrieve()
                                .onStatus(HttpStatusCode::isError, this::upstreamError)
                                .toEntityFlux(DataBuffer.class)
                                .timeout(config.getTimeout())
                                .onErrorMap(this::translateError)))
                .map(entity -> {
                    Flux<byte[]> bytes = entity.getBody() != null
                            ? entity.getBody().map(AbstractProviderAdapter::drain)
                            : Flux.empty();
                    return transpiler.newStreamTranslator(request.getModel())
                            .translate(bytes.onErrorMap(this::translateError))
                            .doOnCancel(() -> log.info("Client disconnected, cancelling {} stream", name));
                });
    }

    /**
     * Upstream URL for the given provider model.
     */
    protected abstract String endpoint(String providerModel, boolean stream);

    /**
     * Native request body; subclasses may wrap it in a transport envelope.
     */
    protected Mono<ObjectNode> buildBody(MessagesRequest request, String providerModel, String token) {
        return Mono.fromCallable(() -> transpiler.convertRequest(request));
    }

    protected void applyHeaders(HttpHeaders headers, String token) {
        headers.setBearerAuth(token);
    }

    protected Mono<UpstreamException> upstreamError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    log.error("{} API error: {} - {}", name, status, body);
                    return new UpstreamException(name, status, body);
                });
    }

    protected Throwable translateError(Throwable error) {
        if (error instanceof GatewayException) {
            return error;
        }
        if (isTimeout(error)) {
            log.error("{} API request timed out after {}", name, config.getTimeout());
            return new UpstreamTimeoutException(name, config.getTimeout(), error);
        }
        if (error instanceof WebClientRequestException) {
            log.error("{} API call failed: {}", name, error.getMessage());
            return new UpstreamException(name, error.getMessage(), error);
        }
        return error;
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
