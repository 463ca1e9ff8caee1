package com.janus.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Content block of a canonical response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentBlock {

    @JsonProperty("type")
    private String type;

    @JsonProperty("text")
    private String text;

    public static ContentBlock text(String text) {
        return new ContentBlock("text", text);
    }
}
