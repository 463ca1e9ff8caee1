package com.janus.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the aggregated model catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {

    @JsonProperty("id")
    private String id;

    @Builder.Default
    @JsonProperty("object")
    private String object = "model";

    @JsonProperty("created")
    private long created;

    @JsonProperty("owned_by")
    private String ownedBy;
}
