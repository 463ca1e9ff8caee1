package com.janus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.janus.auth.OAuthCredentialManager;
import com.janus.config.CredentialConfiguration;
import com.janus.config.JanusProperties;
import com.janus.model.ModelInfo;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated model catalog: Anthropic models (when the caller sent a key), OpenAI models (when
 * authenticated) and the configured Google model lists. Results are cached per caller key.
 */
@Slf4j
@Service
public class ModelRegistryService {

    private static final String ANONYMOUS = "anonymous";

    private final WebClient webClient;
    private final JanusProperties properties;
    private final OAuthCredentialManager openaiCredentials;
    private final Cache<String, List<ModelInfo>> cache;
    private final Clock clock;

    public ModelRegistryService(WebClient webClient,
                                JanusProperties properties,
                                @Qualifier("openaiCredentials") OAuthCredentialManager openaiCredentials,
                                Cache<String, List<ModelInfo>> modelCatalogCache,
                                Clock clock) {
        this.webClient = webClient;
        this.properties = properties;
        this.openaiCredentials = openaiCredentials;
        this.cache = modelCatalogCache;
        this.clock = clock;
    }

    public Mono<List<ModelInfo>> getModels(String anthropicApiKey, String anthropicVersion) {
        // keyed by digest, never by the raw API key
        String cacheKey = anthropicApiKey != null ? DigestUtils.sha256Hex(anthropicApiKey) : ANONYMOUS;
        List<ModelInfo> cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("Returning cached model list");
            return Mono.just(cached);
        }

        log.info("Fetching fresh model list...");
        return Flux.concat(
                        fetchAnthropicModels(anthropicApiKey, anthropicVersion),
                        fetchOpenAiModels(),
                        Flux.fromIterable(staticModels()))
                .collectList()
                .map(ModelRegistryService::deduplicate)
                .doOnNext(models -> cache.put(cacheKey, models));
    }

    private Flux<ModelInfo> fetchAnthropicModels(String apiKey, String version) {
        if (apiKey == null) {
            return Flux.empty();
        }
        JanusProperties.AnthropicConfig anthropic = properties.getAnthropic();
        return webClient.get()
                .uri(anthropic.getBaseUrl() + "/v1/models")
                .header("x-api-key", apiKey)
                .header("anthropic-version", version != null ? version : anthropic.getDefaultVersion())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(anthropic.getTimeout())
                .flatMapIterable(body -> {
                    List<ModelInfo> models = new ArrayList<>();
                    for (JsonNode model : body.path("data")) {
                        models.add(ModelInfo.builder()
                                .id(model.path("id").asText())
                                .created(parseCreatedAt(model.path("created_at").asText(null)))
                                .ownedBy("anthropic")
                                .build());
                    }
                    return models;
                })
                .onErrorResume(e -> {
                    log.error("Failed to fetch Anthropic models: {}", e.getMessage());
                    return Flux.empty();
                });
    }

    private Flux<ModelInfo> fetchOpenAiModels() {
        JanusProperties.ProviderConfig openai = properties.provider(CredentialConfiguration.OPENAI);
        if (!openai.isEnabled()) {
            return Flux.empty();
        }
        return openaiCredentials.getValidToken()
                .flatMap(token -> webClient.get()
                        .uri(openai.getBaseUrl() + "/models")
                        .headers(headers -> headers.setBearerAuth(token))
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .timeout(openai.getTimeout()))
                .flatMapIterable(body -> {
                    List<ModelInfo> models = new ArrayList<>();
                    for (JsonNode model : body.path("data")) {
                        models.add(ModelInfo.builder()
                                .id(model.path("id").asText())
                                .created(model.path("created").asLong(0))
                                .ownedBy(model.path("owned_by").asText("openai"))
                                .build());
                    }
                    return models;
                })
                .onErrorResume(e -> {
                    // Not authenticated, or the refresh failed
                    log.debug("Skipping OpenAI models: {}", e.getMessage());
                    return Flux.empty();
                });
    }

    private List<ModelInfo> staticModels() {
        long now = clock.instant().getEpochSecond();
        List<ModelInfo> models = new ArrayList<>();
        if (properties.provider(CredentialConfiguration.GEMINI).isEnabled()) {
            properties.getModels().getGeminiModels().forEach(id ->
                    models.add(ModelInfo.builder().id(id).created(now).ownedBy("google").build()));
        }
        if (properties.provider(CredentialConfiguration.ANTIGRAVITY).isEnabled()) {
            properties.getModels().getAntigravityModels().forEach(id ->
                    models.add(ModelInfo.builder().id(id).created(now).ownedBy("antigravity").build()));
        }
        return models;
    }

    private long parseCreatedAt(String createdAt) {
        if (createdAt == null) {
            return 0;
        }
        try {
            return Instant.parse(createdAt).getEpochSecond();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable created_at {}", createdAt);
            return 0;
        }
    }

    private static List<ModelInfo> deduplicate(List<ModelInfo> models) {
        Map<String, ModelInfo> unique = new LinkedHashMap<>();
        for (ModelInfo model : models) {
            unique.putIfAbsent(model.getId(), model);
        }
        return List.copyOf(unique.values());
    }
}
