package com.janus.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * OAuth token endpoint response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonProperty("expires_in")
    private Long expiresIn;

    @JsonProperty("token_type")
    private String tokenType;

    @JsonProperty("scope")
    private String scope;

    public TokenRecord toRecord(Instant now) {
        return TokenRecord.builder()
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .expiresAt(expiresIn != null ? now.toEpochMilli() + expiresIn * 1000 : null)
                .scope(scope)
                .build();
    }
}
