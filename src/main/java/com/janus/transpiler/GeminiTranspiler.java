package com.janus.transpiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.janus.model.ContentBlock;
import com.janus.model.InputMessage;
import com.janus.model.MessagesRequest;
import com.janus.model.MessagesResponse;
import com.janus.model.StopReason;
import com.janus.model.StreamEvent;
import com.janus.model.ToolDefinition;
import com.janus.model.Usage;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Canonical protocol to the Gemini {@code generateContent} schema.
 */
@Primary
@Component
public class GeminiTranspiler implements ProtocolTranspiler {

    public static final String DEFAULT_MODEL = "gemini-2.5-pro";

    private static final Map<String, String> MODEL_MAP = Map.of(
            "claude-3-5-sonnet-20241022", "gemini-2.5-pro",
            "claude-3-opus-20240229", "gemini-2.5-pro",
            "claude-3-sonnet-20240229", "gemini-2.5-pro",
            "claude-3-haiku-20240307", "gemini-2.5-flash");

    protected final ObjectMapper objectMapper;

    public GeminiTranspiler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String mapModel(String canonicalModel) {
        String mapped = modelMap().get(canonicalModel);
        if (mapped != null) {
            return mapped;
        }
        return canonicalModel.startsWith("gemini-") ? canonicalModel : DEFAULT_MODEL;
    }

    protected Map<String, String> modelMap() {
        return MODEL_MAP;
    }

    @Override
    public ObjectNode convertRequest(MessagesRequest request) {
        ObjectNode body = objectMapper.createObjectNode();

        ArrayNode contents = body.putArray("contents");
        for (InputMessage message : request.getMessages()) {
            ObjectNode content = contents.addObject();
            content.put("role", "assistant".equals(message.getRole()) ? "model" : "user");
            content.putArray("parts").addObject().put("text", TranspilerSupport.flattenContent(message.getContent()));
        }

        String system = TranspilerSupport.joinSystem(request.getSystem());
        if (system != null) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", system);
        }

        if (request.getMaxTokens() != null || request.getTemperature() != null || request.getTopP() != null) {
            ObjectNode generationConfig = body.putObject("generationConfig");
            if (request.getMaxTokens() != null) {
                generationConfig.put("maxOutputTokens", request.getMaxTokens());
            }
            if (request.getTemperature() != null) {
                generationConfig.put("temperature", request.getTemperature());
            }
            if (request.getTopP() != null) {
                generationConfig.put("topP", request.getTopP());
            }
        }

        addTools(request.getTools(), body);
        return body;
    }

    private static void addTools(List<ToolDefinition> tools, ObjectNode body) {
        if (tools == null || tools.isEmpty()) {
            return;
        }
        List<ToolDefinition> functions = new ArrayList<>();
        boolean webSearch = false;
        for (ToolDefinition tool : tools) {
            if (TranspilerSupport.isWebSearch(tool)) {
                webSearch = true;
            } else {
                functions.add(tool);
            }
        }

        ArrayNode converted = body.putArray("tools");
        if (!functions.isEmpty()) {
            ArrayNode declarations = converted.addObject().putArray("functionDeclarations");
            for (ToolDefinition tool : functions) {
                ObjectNode declaration = declarations.addObject().put("name", tool.getName());
                if (tool.getDescription() != null) {
                    declaration.put("description", tool.getDescription());
                }
                JsonNode parameters = SchemaSanitizer.sanitize(tool.getInputSchema());
                if (parameters != null) {
                    declaration.set("parameters", parameters);
                }
            }
        }
        if (webSearch) {
            converted.addObject().putObject("googleSearch");
        }
    }

    /**
     * Strip any transport envelope around the Gemini payload.
     */
    protected JsonNode unwrap(JsonNode body) {
        return body;
    }

    @Override
    public MessagesResponse convertResponse(JsonNode body, String model) {
        JsonNode payload = unwrap(body);
        JsonNode candidate = payload.path("candidates").path(0);
        JsonNode usage = payload.path("usageMetadata");

        return MessagesResponse.builder()
                .id(TranspilerSupport.newMessageId())
                .content(List.of(ContentBlock.text(candidateText(candidate))))
                .model(model)
                .stopReason(mapFinishReason(candidate))
                .usage(new Usage(usage.path("promptTokenCount").asInt(0),
                        usage.path("candidatesTokenCount").asInt(0)))
                .build();
    }

    static String candidateText(JsonNode candidate) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            // thought summaries are not part of the answer
            if (part.path("text").isTextual() && !part.path("thought").asBoolean(false)) {
                text.append(part.path("text").asText());
            }
        }
        return text.toString();
    }

    static String mapFinishReason(JsonNode candidate) {
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("functionCall")) {
                return StopReason.TOOL_USE;
            }
        }
        return mapFinishReason(candidate.path("finishReason").asText(null));
    }

    static String mapFinishReason(String finishReason) {
        if (finishReason == null) {
            return StopReason.END_TURN;
        }
        return switch (finishReason) {
            case "MAX_TOKENS" -> StopReason.MAX_TOKENS;
            case "STOP_SEQUENCE" -> StopReason.STOP_SEQUENCE;
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII" -> StopReason.REFUSAL;
            default -> StopReason.END_TURN;
        };
    }

    @Override
    public StreamTranslator newStreamTranslator(String model) {
        return new GeminiStreamTranslator(model);
    }

    class GeminiStreamTranslator extends StreamTranslator {

        GeminiStreamTranslator(String model) {
            super(objectMapper, model);
        }

        @Override
        protected void onChunk(JsonNode chunk, List<StreamEvent> out) {
            JsonNode payload = unwrap(chunk);
            JsonNode candidate = payload.path("candidates").path(0);
            if (candidate.isMissingNode()) {
                return;
            }

            emitText(candidateText(candidate), out);

            if (candidate.path("finishReason").isTextual()) {
                close(mapFinishReason(candidate),
                        payload.path("usageMetadata").path("candidatesTokenCount").asInt(0), out);
            }
        }
    }
}
