package com.janus.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted OAuth credential of one provider. {@code expiresAt} is epoch milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenRecord {

    /**
     * Tokens this close to expiry are treated as stale.
     */
    public static final Duration REFRESH_BUFFER = Duration.ofMinutes(5);

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonProperty("expires_at")
    private Long expiresAt;

    @JsonProperty("scope")
    private String scope;

    /**
     * A record without expiry never goes stale.
     */
    public boolean isValidAt(Instant now) {
        if (expiresAt == null) {
            return true;
        }
        return now.toEpochMilli() < expiresAt - REFRESH_BUFFER.toMillis();
    }

    /**
     * Merge a refresh response, keeping the current refresh token unless a rotated one was issued.
     */
    public TokenRecord refreshedWith(TokenResponse response, Instant now) {
        TokenRecord fresh = response.toRecord(now);
        return TokenRecord.builder()
                .accessToken(fresh.getAccessToken())
                .refreshToken(fresh.getRefreshToken() != null ? fresh.getRefreshToken() : refreshToken)
                .expiresAt(fresh.getExpiresAt())
                .scope(fresh.getScope() != null ? fresh.getScope() : scope)
                .build();
    }
}
