package com.janus.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.janus.config.JanusProperties;
import com.janus.exception.UpstreamException;
import com.janus.exception.UpstreamTimeoutException;
import com.janus.model.ApiError;
import com.janus.model.MessagesRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;

/**
 * Forwards requests untouched to the Anthropic API with the caller's own key. Matches every
 * model, so it must stay last in the routing order.
 */
@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
@Component
public class AnthropicPassThroughAdapter implements ProviderAdapter {

    static final String API_KEY_HEADER = "x-api-key";
    static final String VERSION_HEADER = "anthropic-version";
    static final String BETA_HEADER = "anthropic-beta";

    private final WebClient webClient;
    private final JanusProperties.AnthropicConfig config;
    private final ResponseWriter responseWriter;
    private final ObjectMapper objectMapper;

    public AnthropicPassThroughAdapter(WebClient webClient,
                                       JanusProperties properties,
                                       ResponseWriter responseWriter,
                                       ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.config = properties.getAnthropic();
        this.responseWriter = responseWriter;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "anthropic";
    }

    @Override
    public boolean supports(String model) {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public Mono<Void> handle(MessagesRequest request, ServerWebExchange exchange) {
        HttpHeaders incoming = exchange.getRequest().getHeaders();
        String apiKey = incoming.getFirst(API_KEY_HEADER);
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Pass-through request for {} rejected: no {} header", request.getModel(), API_KEY_HEADER);
            return responseWriter.writeJson(exchange.getResponse(), HttpStatus.UNAUTHORIZED,
                    ApiError.of("authentication_error",
                            "Missing x-api-key header. Authenticate a provider or pass an Anthropic API key."));
        }

        String version = incoming.getFirst(VERSION_HEADER);
        String beta = incoming.getFirst(BETA_HEADER);
        ObjectNode body = request.getRawBody() instanceof ObjectNode raw
                ? raw.deepCopy()
                : objectMapper.valueToTree(request);
        body.put("stream", request.isStreaming());

        log.info("Forwarding model {} to Anthropic (stream={})", request.getModel(), request.isStreaming());

        return webClient.post()
                .uri(config.getBaseUrl() + "/v1/messages")
                .headers(headers -> {
                    headers.set(API_KEY_HEADER, apiKey);
                    headers.set(VERSION_HEADER, version != null ? version : config.getDefaultVersion());
                    if (beta != null) {
                        headers.set(BETA_HEADER, beta);
                    }
                })
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                // relayed as-is below
                .onStatus(HttpStatusCode::isError, response -> Mono.empty())
                .toEntityFlux(DataBuffer.class)
                .timeout(config.getTimeout())
                .onErrorMap(this::translateError)
                .flatMap(entity -> {
                    if (entity.getStatusCode().isError()) {
                        log.error("Anthropic API error: {}", entity.getStatusCode().value());
                    }
                    Flux<DataBuffer> upstream = entity.getBody() != null ? entity.getBody() : Flux.empty();
                    return responseWriter.relay(exchange.getResponse(), entity.getStatusCode(),
                            entity.getHeaders().getContentType(),
                            upstream.doOnCancel(() -> log.info("Client disconnected, cancelling Anthropic stream")),
                            getName());
                });
    }

    private Throwable translateError(Throwable error) {
        if (error instanceof TimeoutException) {
            log.error("Anthropic API request timed out after {}", config.getTimeout());
            return new UpstreamTimeoutException(getName(), config.getTimeout(), error);
        }
        if (error instanceof WebClientRequestException) {
            log.error("Anthropic API call failed: {}", error.getMessage());
            return new UpstreamException(getName(), error.getMessage(), error);
        }
        return error;
    }
}
