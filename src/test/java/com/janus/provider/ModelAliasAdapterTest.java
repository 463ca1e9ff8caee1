package com.janus.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.janus.auth.OAuthCredentialManager;
import com.janus.config.JacksonConfiguration;
import com.janus.config.JanusProperties;
import com.janus.model.InputMessage;
import com.janus.model.MessagesRequest;
import com.janus.support.StubExchangeFunction;
import com.janus.transpiler.OpenAiTranspiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for ModelAliasAdapter.
 */
class ModelAliasAdapterTest {

    private ObjectMapper objectMapper;
    private JanusProperties properties;
    private StubExchangeFunction upstream;
    private OpenAiAdapter openAi;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        properties = new JanusProperties();
        JanusProperties.ProviderConfig openai = new JanusProperties.ProviderConfig();
        openai.setBaseUrl("https://api.openai.test/v1");
        properties.getProviders().put("openai", openai);
        properties.getRouting().getAliases().put("claude-3-5-sonnet-20241022", "openai");
        properties.getRouting().getAliases().put("claude-3-haiku-20240307", "nowhere");

        OAuthCredentialManager credentials = mock(OAuthCredentialManager.class);
        when(credentials.getValidToken()).thenReturn(Mono.just("access-123"));

        upstream = new StubExchangeFunction(r -> StubExchangeFunction.json(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"content\":\"aliased\"},\"finish_reason\":\"length\"}],"
                        + "\"usage\":{\"prompt_tokens\":4,\"completion_tokens\":9}}"));
        openAi = new OpenAiAdapter(upstream.webClient(), properties, credentials,
                new OpenAiTranspiler(objectMapper), new ResponseWriter(objectMapper));
    }

    @Test
    void testSupportsOnlyResolvableAliases() {
        ModelAliasAdapter alias = new ModelAliasAdapter(properties, List.of(openAi));

        assertTrue(alias.supports("claude-3-5-sonnet-20241022"));
        assertFalse(alias.supports("claude-3-haiku-20240307"));
        assertFalse(alias.supports("claude-3-opus-20240229"));
        assertFalse(alias.supports(null));
    }

    @Test
    void testDisabledTargetIsNotSupported() {
        properties.provider("openai").setEnabled(false);
        ModelAliasAdapter alias = new ModelAliasAdapter(properties, List.of(openAi));

        assertFalse(alias.supports("claude-3-5-sonnet-20241022"));
    }

    @Test
    void testDelegatesAndEchoesCanonicalModel() throws Exception {
        ModelAliasAdapter alias = new ModelAliasAdapter(properties, List.of(openAi));
        MessagesRequest request = MessagesRequest.builder()
                .model("claude-3-5-sonnet-20241022")
                .messages(List.of(InputMessage.of("user", "Hello")))
                .stream(false)
                .build();
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/v1/messages"));

        alias.handle(request, exchange).block();

        assertEquals("gpt-4o", objectMapper.readTree(upstream.lastRequest().body()).path("model").asText());
        JsonNode body = objectMapper.readTree(exchange.getResponse().getBodyAsString().block());
        assertEquals("claude-3-5-sonnet-20241022", body.path("model").asText());
        assertEquals("aliased", body.path("content").path(0).path("text").asText());
        assertEquals("max_tokens", body.path("stop_reason").asText());
        assertEquals(9, body.path("usage").path("output_tokens").asInt());
    }
}
