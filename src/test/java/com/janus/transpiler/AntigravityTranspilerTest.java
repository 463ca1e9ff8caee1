package com.janus.transpiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.janus.config.JacksonConfiguration;
import com.janus.model.MessagesResponse;
import com.janus.model.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AntigravityTranspiler.
 */
class AntigravityTranspilerTest {

    private ObjectMapper objectMapper;
    private AntigravityTranspiler transpiler;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        transpiler = new AntigravityTranspiler(objectMapper);
    }

    @Test
    void testModelMappingStripsRoutingPrefix() {
        assertEquals("gemini-3-pro", transpiler.mapModel("antigravity-gemini-3-pro"));
        assertEquals("gemini-3-flash", transpiler.mapModel("claude-3-5-sonnet-20241022"));
        assertEquals(GeminiTranspiler.DEFAULT_MODEL, transpiler.mapModel("antigravity-unknown"));
    }

    @Test
    void testResponseEnvelopeIsUnwrapped() throws Exception {
        MessagesResponse response = transpiler.convertResponse(objectMapper.readTree(
                "{\"response\":{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hello from Gemini!\"}],"
                        + "\"role\":\"model\"},\"finishReason\":\"STOP\"}],"
                        + "\"usageMetadata\":{\"promptTokenCount\":10,\"candidatesTokenCount\":5}}}"),
                "claude-3-5-sonnet-20241022");

        assertEquals("Hello from Gemini!", response.getContent().get(0).getText());
        assertEquals("end_turn", response.getStopReason());
        assertEquals(10, response.getUsage().getInputTokens());
        assertEquals(5, response.getUsage().getOutputTokens());
        assertEquals("claude-3-5-sonnet-20241022", response.getModel());
    }

    @Test
    void testStreamChunksAreUnwrapped() {
        StreamTranslator translator = transpiler.newStreamTranslator("antigravity-gemini-3-pro");
        String body = "data: {\"response\":{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hi\"}]},"
                + "\"finishReason\":\"MAX_TOKENS\"}]}}\n\n";

        List<StreamEvent> events = translator.translate(
                Flux.just(body.getBytes(StandardCharsets.UTF_8))).collectList().block();

        assertNotNull(events);
        assertEquals("Hi", events.get(2).getData().path("delta").path("text").asText());
        assertEquals("max_tokens", events.get(4).getData().path("delta").path("stop_reason").asText());
        assertEquals(StreamTranslator.State.CLOSED, translator.getState());
    }
}
