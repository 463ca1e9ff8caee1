package com.janus.auth;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenRecord validity and refresh merging.
 */
class TokenRecordTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static TokenRecord expiringIn(Duration duration) {
        return TokenRecord.builder()
                .accessToken("a")
                .expiresAt(NOW.plus(duration).toEpochMilli())
                .build();
    }

    @Test
    void testValidityTable() {
        assertTrue(TokenRecord.builder().accessToken("a").build().isValidAt(NOW));
        assertTrue(expiringIn(Duration.ofMinutes(10)).isValidAt(NOW));
        assertFalse(expiringIn(Duration.ofMinutes(3)).isValidAt(NOW));
        assertFalse(expiringIn(Duration.ofMinutes(5)).isValidAt(NOW));
        assertFalse(expiringIn(Duration.ofMinutes(-1)).isValidAt(NOW));
    }

    @Test
    void testRefreshKeepsRefreshTokenWhenNotRotated() {
        TokenRecord current = TokenRecord.builder()
                .accessToken("old")
                .refreshToken("refresh-1")
                .expiresAt(NOW.toEpochMilli())
                .scope("openid")
                .build();
        TokenResponse response = TokenResponse.builder().accessToken("new").expiresIn(3600L).build();

        TokenRecord refreshed = current.refreshedWith(response, NOW);

        assertEquals("new", refreshed.getAccessToken());
        assertEquals("refresh-1", refreshed.getRefreshToken());
        assertEquals("openid", refreshed.getScope());
        assertEquals(NOW.plusSeconds(3600).toEpochMilli(), refreshed.getExpiresAt());
    }

    @Test
    void testRefreshAdoptsRotatedRefreshToken() {
        TokenRecord current = TokenRecord.builder().accessToken("old").refreshToken("refresh-1").build();
        TokenResponse response = TokenResponse.builder()
                .accessToken("new")
                .refreshToken("refresh-2")
                .expiresIn(60L)
                .build();

        assertEquals("refresh-2", current.refreshedWith(response, NOW).getRefreshToken());
    }
}
