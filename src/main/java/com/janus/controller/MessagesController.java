package com.janus.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.janus.exception.TranspilerException;
import com.janus.model.MessagesRequest;
import com.janus.service.AdapterRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Canonical Messages endpoint. The selected adapter writes the JSON body or event stream itself.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class MessagesController {

    private final AdapterRouter adapterRouter;
    private final ObjectMapper objectMapper;

    public MessagesController(AdapterRouter adapterRouter, ObjectMapper objectMapper) {
        this.adapterRouter = adapterRouter;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/messages", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Void> createMessage(@RequestBody JsonNode body, ServerWebExchange exchange) {
        MessagesRequest request;
        try {
            request = objectMapper.treeToValue(body, MessagesRequest.class);
        } catch (JsonProcessingException e) {
            return Mono.error(new TranspilerException("Invalid request body: " + e.getOriginalMessage()));
        }
        request.setRawBody(body);

        log.info("Received message request for model: {}, stream: {}", request.getModel(), request.isStreaming());

        if (request.getModel() == null || request.getModel().isBlank()) {
            return Mono.error(new IllegalArgumentException("Model must be specified"));
        }
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            return Mono.error(new IllegalArgumentException("Messages cannot be empty"));
        }

        return Mono.defer(() -> adapterRouter.selectAdapter(request.getModel()).handle(request, exchange));
    }
}
