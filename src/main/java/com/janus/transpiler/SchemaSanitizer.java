package com.janus.transpiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Copies a JSON schema into the subset accepted by Gemini function declarations.
 */
public final class SchemaSanitizer {

    private static final Set<String> UNSUPPORTED_KEYWORDS = Set.of(
            "$schema", "$id", "$ref", "$defs", "definitions",
            "additionalProperties", "default", "examples", "title");

    private SchemaSanitizer() {
    }

    /**
     * @return a sanitized deep copy; the input is left untouched
     */
    public static JsonNode sanitize(JsonNode schema) {
        if (schema == null || schema.isNull() || schema.isMissingNode()) {
            return null;
        }
        return copy(schema, false);
    }

    private static JsonNode copy(JsonNode node, boolean propertyMap) {
        if (node.isObject()) {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                // Under "properties" the keys are user field names, not keywords
                if (!propertyMap && UNSUPPORTED_KEYWORDS.contains(key)) {
                    continue;
                }
                if (!propertyMap && "const".equals(key)) {
                    result.putArray("enum").add(field.getValue().deepCopy());
                    continue;
                }
                result.set(key, copy(field.getValue(), !propertyMap && "properties".equals(key)));
            }
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            for (JsonNode item : node) {
                result.add(copy(item, false));
            }
            return result;
        }
        return node.deepCopy();
    }
}
