package com.janus.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.janus.auth.OAuthCredentialManager;
import com.janus.config.CredentialConfiguration;
import com.janus.config.JanusProperties;
import com.janus.exception.ConfigurationException;
import com.janus.model.MessagesRequest;
import com.janus.transpiler.AntigravityTranspiler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Gemini models served through the Cloud Code Assist backend. Requests are wrapped as
 * {@code {model, project, request}}; the project is resolved once per process.
 */
@Slf4j
@Order(2)
@Component
public class AntigravityAdapter extends AbstractProviderAdapter {

    private final ObjectMapper objectMapper;
    private final AtomicReference<String> projectId = new AtomicReference<>();

    public AntigravityAdapter(WebClient webClient,
                              JanusProperties properties,
                              @Qualifier("antigravityCredentials") OAuthCredentialManager credentials,
                              AntigravityTranspiler transpiler,
                              ResponseWriter responseWriter,
                              ObjectMapper objectMapper) {
        super(CredentialConfiguration.ANTIGRAVITY, webClient, properties, credentials, transpiler, responseWriter);
        this.objectMapper = objectMapper;
        if (config.getProjectId() != null && !config.getProjectId().isBlank()) {
            projectId.set(config.getProjectId());
        }
    }

    @Override
    public boolean supports(String model) {
        return model != null && model.contains("antigravity");
    }

    @Override
    protected String endpoint(String providerModel, boolean stream) {
        return config.getBaseUrl() + (stream ? "/v1internal:streamGenerateContent?alt=sse" : "/v1internal:generateContent");
    }

    @Override
    protected Mono<ObjectNode> buildBody(MessagesRequest request, String providerModel, String token) {
        return super.buildBody(request, providerModel, token)
                .zipWith(resolveProject(token))
                .map(parts -> {
                    ObjectNode envelope = objectMapper.createObjectNode();
                    envelope.put("model", providerModel);
                    envelope.put("project", parts.getT2());
                    envelope.set("request", parts.getT1());
                    return envelope;
                });
    }

    /**
     * Cloud Code project of the signed-in account. Concurrent first calls may both ask; the answer is the same.
     */
    Mono<String> resolveProject(String token) {
        String cached = projectId.get();
        if (cached != null) {
            return Mono.just(cached);
        }

        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode metadata = body.putObject("metadata");
        metadata.put("ideType", "IDE_UNSPECIFIED");
        metadata.put("platform", "PLATFORM_UNSPECIFIED");
        metadata.put("pluginType", "GEMINI");

        return webClient.post()
                .uri(config.getBaseUrl() + "/v1internal:loadCodeAssist")
                .headers(headers -> applyHeaders(headers, token))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::upstreamError)
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .onErrorMap(this::translateError)
                .map(response -> {
                    JsonNode project = response.path("cloudaicompanionProject");
                    String id = project.isTextual() ? project.asText() : project.path("id").asText(null);
                    if (id == null || id.isBlank()) {
                        throw new ConfigurationException("No Cloud Code project is associated with this account; "
                                + "set janus.providers.antigravity.project-id");
                    }
                    projectId.set(id);
                    log.info("Resolved Cloud Code project {}", id);
                    return id;
                });
    }
}
