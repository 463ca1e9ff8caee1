package com.janus.transpiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.janus.model.MessagesRequest;
import com.janus.model.MessagesResponse;

/**
 * Bidirectional conversion between the canonical protocol and one provider's native schema.
 * Implementations never mutate the canonical request.
 */
public interface ProtocolTranspiler {

    /**
     * Provider model identifier for a canonical one.
     */
    String mapModel(String canonicalModel);

    /**
     * Build the native request body.
     *
     * @throws com.janus.exception.TranspilerException when a message has unsupported content
     */
    ObjectNode convertRequest(MessagesRequest request);

    /**
     * Convert a complete native response; {@code model} is echoed back as requested by the caller.
     */
    MessagesResponse convertResponse(JsonNode body, String model);

    /**
     * Fresh single-use translator for one streamed response.
     */
    StreamTranslator newStreamTranslator(String model);
}
