package com.janus.auth;

import java.time.Instant;

/**
 * Snapshot of a provider's stored credential.
 */
public record CredentialStatus(String provider, State state, Instant expiresAt) {

    public enum State {
        UNAUTHENTICATED,
        VALID,
        STALE
    }

    public boolean isAuthenticated() {
        return state != State.UNAUTHENTICATED;
    }
}
