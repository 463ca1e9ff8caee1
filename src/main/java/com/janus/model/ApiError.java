package com.janus.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical error envelope: {@code {"type":"error","error":{"type":...,"message":...}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    @JsonProperty("type")
    private String type;

    @JsonProperty("error")
    private Detail error;

    public static ApiError of(String errorType, String message) {
        return new ApiError("error", new Detail(errorType, message));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Detail {

        @JsonProperty("type")
        private String type;

        @JsonProperty("message")
        private String message;
    }
}
