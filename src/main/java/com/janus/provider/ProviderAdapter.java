package com.janus.provider;

import com.janus.model.MessagesRequest;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * A backend able to answer canonical Messages requests.
 * Implementations handle provider-specific authentication, request/response conversion,
 * and API communication.
 */
public interface ProviderAdapter {

    /**
     * Adapter name (e.g., "openai", "gemini", "anthropic").
     *
     * @return adapter name
     */
    String getName();

    /**
     * Pure predicate over the requested model identifier.
     *
     * @param model canonical model name
     * @return true if this adapter serves the model
     */
    boolean supports(String model);

    /**
     * Serve the request, writing either a JSON body or an event stream to the exchange response.
     * Errors signalled before anything is written are rendered by the global exception handler.
     *
     * @param request canonical request
     * @param exchange current exchange
     * @return completion of the response
     */
    Mono<Void> handle(MessagesRequest request, ServerWebExchange exchange);

    /**
     * Check if the adapter is enabled in configuration.
     *
     * @return true if ready to use
     */
    default boolean isEnabled() {
        return true;
    }
}
