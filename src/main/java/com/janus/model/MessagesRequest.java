package com.janus.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Canonical (Anthropic Messages API) request.
 * {@code system} may be a string or an array of text blocks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessagesRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("messages")
    private List<InputMessage> messages;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("system")
    private JsonNode system;

    @JsonProperty("tools")
    private List<ToolDefinition> tools;

    // Body as received, forwarded untouched by the pass-through adapter
    @JsonIgnore
    private JsonNode rawBody;

    /**
     * Streaming unless the caller sent {@code "stream": false}.
     */
    @JsonIgnore
    public boolean isStreaming() {
        return !Boolean.FALSE.equals(stream);
    }
}
