package com.janus.auth;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PKCE verifier and its S256 challenge (RFC 7636).
 */
public record PkceChallenge(String verifier, String challenge) {

    public static final String METHOD = "S256";

    private static final SecureRandom RANDOM = new SecureRandom();

    public static PkceChallenge generate() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        String verifier = base64Url(bytes);
        return new PkceChallenge(verifier, challengeFor(verifier));
    }

    public static String challengeFor(String verifier) {
        return base64Url(DigestUtils.sha256(verifier.getBytes(StandardCharsets.US_ASCII)));
    }

    private static String base64Url(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
