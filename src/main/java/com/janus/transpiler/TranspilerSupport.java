package com.janus.transpiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.janus.exception.TranspilerException;
import com.janus.model.ToolDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Conversions shared by every transpiler.
 */
public final class TranspilerSupport {

    private TranspilerSupport() {
    }

    /**
     * Flatten message content to plain text. Arrays keep only non-empty text blocks, joined by newlines.
     *
     * @throws TranspilerException for any shape other than a string or an array
     */
    public static String flattenContent(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            throw new TranspilerException("Unsupported message content format");
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            return joinTextBlocks(content);
        }
        throw new TranspilerException("Unsupported message content format");
    }

    /**
     * Join the system prompt, given either as a string or as text blocks.
     *
     * @return the prompt, or null when absent or empty
     */
    public static String joinSystem(JsonNode system) {
        if (system == null || system.isNull() || system.isMissingNode()) {
            return null;
        }
        String text;
        if (system.isTextual()) {
            text = system.asText();
        } else if (system.isArray()) {
            text = joinTextBlocks(system);
        } else {
            throw new TranspilerException("Unsupported system prompt format");
        }
        return text.isEmpty() ? null : text;
    }

    private static String joinTextBlocks(JsonNode blocks) {
        List<String> texts = new ArrayList<>();
        for (JsonNode block : blocks) {
            if ("text".equals(block.path("type").asText()) && !block.path("text").asText().isEmpty()) {
                texts.add(block.path("text").asText());
            }
        }
        return String.join("\n", texts);
    }

    public static boolean isWebSearch(ToolDefinition tool) {
        return "web_search".equals(tool.getName())
                || (tool.getType() != null && tool.getType().startsWith("web_search"));
    }

    public static String newMessageId() {
        return "msg_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
