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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonical protocol to OpenAI Chat Completions.
 */
@Component
public class OpenAiTranspiler implements ProtocolTranspiler {

    public static final String DEFAULT_MODEL = "gpt-4o";

    static final Pattern NATIVE_MODEL = Pattern.compile("^(gpt|o[1-9]|chatgpt)-.*");

    private static final Map<String, String> MODEL_MAP = Map.of(
            "claude-3-5-sonnet-20241022", "gpt-4o",
            "claude-3-opus-20240229", "gpt-4o",
            "claude-3-sonnet-20240229", "gpt-4o",
            "claude-3-haiku-20240307", "gpt-4o-mini");

    private final ObjectMapper objectMapper;

    public OpenAiTranspiler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * True for identifiers OpenAI understands as-is.
     */
    public static boolean isNativeModel(String model) {
        return NATIVE_MODEL.matcher(model).matches() || model.contains("codex");
    }

    @Override
    public String mapModel(String canonicalModel) {
        String mapped = MODEL_MAP.get(canonicalModel);
        if (mapped != null) {
            return mapped;
        }
        return isNativeModel(canonicalModel) ? canonicalModel : DEFAULT_MODEL;
    }

    @Override
    public ObjectNode convertRequest(MessagesRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", mapModel(request.getModel()));

        ArrayNode messages = body.putArray("messages");
        String system = TranspilerSupport.joinSystem(request.getSystem());
        if (system != null) {
            messages.addObject().put("role", "system").put("content", system);
        }
        for (InputMessage message : request.getMessages()) {
            messages.addObject()
                    .put("role", message.getRole())
                    .put("content", TranspilerSupport.flattenContent(message.getContent()));
        }

        if (request.getMaxTokens() != null) {
            body.put("max_tokens", request.getMaxTokens());
        }
        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            body.put("top_p", request.getTopP());
        }
        // selects the response format, so always sent
        body.put("stream", request.isStreaming());
        addTools(request.getTools(), body);
        return body;
    }

    private static void addTools(List<ToolDefinition> tools, ObjectNode body) {
        if (tools == null || tools.isEmpty()) {
            return;
        }
        ArrayNode converted = body.putArray("tools");
        for (ToolDefinition tool : tools) {
            ObjectNode function = converted.addObject().put("type", "function").putObject("function");
            function.put("name", tool.getName());
            if (tool.getDescription() != null) {
                function.put("description", tool.getDescription());
            }
            if (tool.getInputSchema() != null) {
                function.set("parameters", tool.getInputSchema().deepCopy());
            }
        }
    }

    @Override
    public MessagesResponse convertResponse(JsonNode body, String model) {
        JsonNode choice = body.path("choices").path(0);
        JsonNode usage = body.path("usage");

        return MessagesResponse.builder()
                .id(TranspilerSupport.newMessageId())
                .content(List.of(ContentBlock.text(choice.path("message").path("content").asText(""))))
                .model(model)
                .stopReason(mapFinishReason(choice.path("finish_reason").asText(null)))
                .usage(new Usage(usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0)))
                .build();
    }

    static String mapFinishReason(String finishReason) {
        if (finishReason == null) {
            return StopReason.END_TURN;
        }
        return switch (finishReason) {
            case "length" -> StopReason.MAX_TOKENS;
            case "tool_calls", "function_call" -> StopReason.TOOL_USE;
            case "content_filter" -> StopReason.REFUSAL;
            default -> StopReason.END_TURN;
        };
    }

    @Override
    public StreamTranslator newStreamTranslator(String model) {
        return new OpenAiStreamTranslator(objectMapper, model);
    }

    static class OpenAiStreamTranslator extends StreamTranslator {

        OpenAiStreamTranslator(ObjectMapper objectMapper, String model) {
            super(objectMapper, model);
        }

        @Override
        protected void onChunk(JsonNode chunk, List<StreamEvent> out) {
            JsonNode choice = chunk.path("choices").path(0);
            JsonNode content = choice.path("delta").path("content");
            if (content.isTextual()) {
                emitText(content.asText(), out);
            }

            JsonNode finishReason = choice.path("finish_reason");
            if (finishReason.isTextual()) {
                close(mapFinishReason(finishReason.asText()),
                        chunk.path("usage").path("completion_tokens").asInt(0), out);
            }
        }
    }
}
