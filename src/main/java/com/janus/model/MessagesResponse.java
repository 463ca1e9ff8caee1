package com.janus.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Canonical non-streaming response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessagesResponse {

    @JsonProperty("id")
    private String id;

    @Builder.Default
    @JsonProperty("type")
    private String type = "message";

    @Builder.Default
    @JsonProperty("role")
    private String role = "assistant";

    @JsonProperty("content")
    private List<ContentBlock> content;

    @JsonProperty("model")
    private String model;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonProperty("stop_reason")
    private String stopReason;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonProperty("stop_sequence")
    private String stopSequence;

    @JsonProperty("usage")
    private Usage usage;
}
