package com.janus.transpiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Gemini schema as spoken by the Cloud Code Assist backend. Responses arrive wrapped as
 * {@code {"response": {...}}}; the request envelope is added by the adapter, which knows the project.
 */
@Component
public class AntigravityTranspiler extends GeminiTranspiler {

    public static final String MODEL_PREFIX = "antigravity-";

    private static final Map<String, String> MODEL_MAP = Map.of(
            "claude-3-5-sonnet-20241022", "gemini-3-flash",
            "claude-3-opus-20240229", "gemini-2.5-pro",
            "claude-3-sonnet-20240229", "gemini-2.5-pro",
            "claude-3-haiku-20240307", "gemini-2.5-flash");

    public AntigravityTranspiler(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public String mapModel(String canonicalModel) {
        String model = canonicalModel.startsWith(MODEL_PREFIX)
                ? canonicalModel.substring(MODEL_PREFIX.length())
                : canonicalModel;
        return super.mapModel(model);
    }

    @Override
    protected Map<String, String> modelMap() {
        return MODEL_MAP;
    }

    @Override
    protected JsonNode unwrap(JsonNode body) {
        JsonNode response = body.path("response");
        return response.isObject() ? response : body;
    }
}
