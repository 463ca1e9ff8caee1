package com.janus.controller;

import com.janus.model.ModelInfo;
import com.janus.service.ModelRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for ModelsController and HealthController.
 */
class ModelsControllerTest {

    private ModelRegistryService registry;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        registry = mock(ModelRegistryService.class);
        client = WebTestClient.bindToController(new ModelsController(registry), new HealthController())
                .controllerAdvice(new GatewayExceptionHandler())
                .build();
    }

    @Test
    void testListModels() {
        when(registry.getModels("sk-ant-test", "2023-06-01")).thenReturn(Mono.just(List.of(
                ModelInfo.builder().id("gpt-4o").created(1715367049).ownedBy("openai").build())));

        client.get()
                .uri("/v1/models")
                .header("x-api-key", "sk-ant-test")
                .header("anthropic-version", "2023-06-01")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.data[0].id").isEqualTo("gpt-4o")
                .jsonPath("$.data[0].object").isEqualTo("model")
                .jsonPath("$.data[0].owned_by").isEqualTo("openai");
    }

    @Test
    void testListModelsWithoutHeaders() {
        when(registry.getModels(isNull(), isNull())).thenReturn(Mono.just(List.of()));

        client.get()
                .uri("/v1/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data").isEmpty();

        verify(registry).getModels(isNull(), isNull());
    }

    @Test
    void testHealth() {
        client.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.version").exists();
    }
}
