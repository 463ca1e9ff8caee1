package com.janus.transpiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.janus.config.JacksonConfiguration;
import com.janus.model.InputMessage;
import com.janus.model.MessagesRequest;
import com.janus.model.MessagesResponse;
import com.janus.model.StreamEvent;
import com.janus.model.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GeminiTranspiler.
 */
class GeminiTranspilerTest {

    private ObjectMapper objectMapper;
    private GeminiTranspiler transpiler;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        transpiler = new GeminiTranspiler(objectMapper);
    }

    @Test
    void testConversationAndSystemInstruction() throws Exception {
        MessagesRequest request = MessagesRequest.builder()
                .model("gemini-2.5-flash")
                .system(objectMapper.readTree("\"You are helpful.\""))
                .messages(List.of(
                        InputMessage.of("user", "Hi"),
                        InputMessage.of("assistant", "Hello!"),
                        InputMessage.of("user", "How are you?")))
                .build();

        ObjectNode body = transpiler.convertRequest(request);

        JsonNode contents = body.path("contents");
        assertEquals(3, contents.size());
        assertEquals("user", contents.path(0).path("role").asText());
        assertEquals("model", contents.path(1).path("role").asText());
        assertEquals("Hello!", contents.path(1).path("parts").path(0).path("text").asText());
        assertEquals("You are helpful.",
                body.path("systemInstruction").path("parts").path(0).path("text").asText());
        assertFalse(body.has("generationConfig"));
    }

    @Test
    void testGenerationConfigCarriesOnlyPresentFields() {
        MessagesRequest request = MessagesRequest.builder()
                .model("gemini-2.5-pro")
                .messages(List.of(InputMessage.of("user", "Hi")))
                .maxTokens(100)
                .topP(0.5)
                .build();

        JsonNode config = transpiler.convertRequest(request).path("generationConfig");

        assertEquals(100, config.path("maxOutputTokens").asInt());
        assertEquals(0.5, config.path("topP").asDouble());
        assertFalse(config.has("temperature"));
    }

    @Test
    void testToolsBecomeFunctionDeclarationsAndSearch() throws Exception {
        MessagesRequest request = MessagesRequest.builder()
                .model("gemini-2.5-pro")
                .messages(List.of(InputMessage.of("user", "Hi")))
                .tools(List.of(
                        ToolDefinition.builder()
                                .name("lookup")
                                .description("Find a record")
                                .inputSchema(objectMapper.readTree("{\"$schema\":\"x\",\"type\":\"object\","
                                        + "\"additionalProperties\":false,"
                                        + "\"properties\":{\"title\":{\"type\":\"string\",\"default\":\"a\"},"
                                        + "\"kind\":{\"const\":\"book\"}}}"))
                                .build(),
                        ToolDefinition.builder().type("web_search_20250305").name("web_search").build()))
                .build();

        JsonNode tools = transpiler.convertRequest(request).path("tools");

        assertEquals(2, tools.size());
        JsonNode declaration = tools.path(0).path("functionDeclarations").path(0);
        assertEquals("lookup", declaration.path("name").asText());
        JsonNode parameters = declaration.path("parameters");
        assertFalse(parameters.has("$schema"));
        assertFalse(parameters.has("additionalProperties"));
        assertTrue(parameters.path("properties").has("title"));
        assertFalse(parameters.path("properties").path("title").has("default"));
        assertEquals("book", parameters.path("properties").path("kind").path("enum").path(0).asText());
        assertTrue(tools.path(1).has("googleSearch"));
    }

    @Test
    void testModelMapping() {
        assertEquals("gemini-2.5-pro", transpiler.mapModel("claude-3-opus-20240229"));
        assertEquals("gemini-2.5-flash", transpiler.mapModel("claude-3-haiku-20240307"));
        assertEquals("gemini-2.0-flash", transpiler.mapModel("gemini-2.0-flash"));
        assertEquals(GeminiTranspiler.DEFAULT_MODEL, transpiler.mapModel("unknown-model"));
    }

    @Test
    void testResponseConversion() throws Exception {
        JsonNode upstream = objectMapper.readTree("{\"candidates\":[{\"content\":{\"role\":\"model\","
                + "\"parts\":[{\"text\":\"thinking\",\"thought\":true},{\"text\":\"Hello \"},{\"text\":\"world\"}]},"
                + "\"finishReason\":\"STOP\"}],"
                + "\"usageMetadata\":{\"promptTokenCount\":4,\"candidatesTokenCount\":2}}");

        MessagesResponse response = transpiler.convertResponse(upstream, "gemini-2.5-pro");

        assertEquals("Hello world", response.getContent().get(0).getText());
        assertEquals("end_turn", response.getStopReason());
        assertEquals(4, response.getUsage().getInputTokens());
        assertEquals(2, response.getUsage().getOutputTokens());
        assertEquals("gemini-2.5-pro", response.getModel());
    }

    @Test
    void testFunctionCallMapsToToolUse() throws Exception {
        JsonNode upstream = objectMapper.readTree("{\"candidates\":[{\"content\":{"
                + "\"parts\":[{\"functionCall\":{\"name\":\"lookup\",\"args\":{}}}]},\"finishReason\":\"STOP\"}]}");

        MessagesResponse response = transpiler.convertResponse(upstream, "gemini-2.5-pro");

        assertEquals("tool_use", response.getStopReason());
        assertEquals("", response.getContent().get(0).getText());
    }

    @Test
    void testFinishReasonTable() {
        assertEquals("end_turn", GeminiTranspiler.mapFinishReason("STOP"));
        assertEquals("end_turn", GeminiTranspiler.mapFinishReason("FINISHED"));
        assertEquals("end_turn", GeminiTranspiler.mapFinishReason("INTERRUPTED"));
        assertEquals("max_tokens", GeminiTranspiler.mapFinishReason("MAX_TOKENS"));
        assertEquals("stop_sequence", GeminiTranspiler.mapFinishReason("STOP_SEQUENCE"));
        assertEquals("refusal", GeminiTranspiler.mapFinishReason("SAFETY"));
        assertEquals("refusal", GeminiTranspiler.mapFinishReason("RECITATION"));
        assertEquals("refusal", GeminiTranspiler.mapFinishReason("PROHIBITED_CONTENT"));
        assertEquals("end_turn", GeminiTranspiler.mapFinishReason("OTHER"));
        assertEquals("end_turn", GeminiTranspiler.mapFinishReason((String) null));
    }

    @Test
    void testStreamTranslation() {
        StreamTranslator translator = transpiler.newStreamTranslator("gemini-2.5-pro");
        String body = "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hel\"}]}}]}\r\n\r\n"
                + "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"lo\"}]},\"finishReason\":\"SAFETY\"}],"
                + "\"usageMetadata\":{\"candidatesTokenCount\":3}}\r\n\r\n";

        List<StreamEvent> events = new ArrayList<>(translator.start());
        events.addAll(translator.advance(body.getBytes(StandardCharsets.UTF_8)));
        events.addAll(translator.finish());

        assertEquals(List.of("message_start", "content_block_start", "content_block_delta",
                "content_block_delta", "content_block_stop", "message_delta", "message_stop"),
                events.stream().map(StreamEvent::getEvent).toList());
        JsonNode delta = events.get(5).getData();
        assertEquals("refusal", delta.path("delta").path("stop_reason").asText());
        assertEquals(3, delta.path("usage").path("output_tokens").asInt());
    }
}
