package com.janus.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One conversation turn. Content is either a plain string or an array of typed blocks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InputMessage {

    @JsonProperty("role")
    private String role; // user, assistant

    @JsonProperty("content")
    private JsonNode content;

    public static InputMessage of(String role, String text) {
        return new InputMessage(role, TextNode.valueOf(text));
    }
}
