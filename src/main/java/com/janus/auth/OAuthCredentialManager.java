package com.janus.auth;

import com.janus.config.JanusProperties;
import com.janus.exception.AuthenticationException;
import com.janus.exception.ConfigurationException;
import com.janus.exception.CredentialStoreException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * OAuth credential lifecycle of one provider: interactive login, lazy refresh and status.
 *
 * <p>Credentials move through Unauthenticated, PendingAuthorization, Authenticated (valid or
 * stale) and Refreshing. A failed refresh removes the stored record so the next call reports
 * the provider as unauthenticated.</p>
 */
@Slf4j
public class OAuthCredentialManager {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final String provider;
    private final JanusProperties.OAuthConfig oauth;
    private final CredentialStore store;
    private final WebClient webClient;
    private final BrowserLauncher browser;
    private final Clock clock;

    public OAuthCredentialManager(String provider,
                                  JanusProperties.OAuthConfig oauth,
                                  CredentialStore store,
                                  WebClient webClient,
                                  BrowserLauncher browser,
                                  Clock clock) {
        this.provider = provider;
        this.oauth = oauth;
        this.store = store;
        this.webClient = webClient;
        this.browser = browser;
        this.clock = clock;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * Access token for an outbound call, refreshed once when stale.
     *
     * @return the bearer token
     * @throws AuthenticationException (as an error signal) when no usable credential exists
     */
    public Mono<String> getValidToken() {
        return loadRecord()
                .switchIfEmpty(Mono.error(() -> AuthenticationException.noCredential(provider)))
                .flatMap(record -> {
                    if (record.isValidAt(clock.instant())) {
                        return Mono.just(record.getAccessToken());
                    }
                    log.info("{} token expired or expiring soon, refreshing", provider);
                    return refresh(record).map(TokenRecord::getAccessToken);
                });
    }

    private Mono<TokenRecord> refresh(TokenRecord current) {
        if (current.getRefreshToken() == null) {
            return discard(AuthenticationException.refreshFailed(provider,
                    new IllegalStateException("No refresh token stored")));
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", current.getRefreshToken());
        form.add("client_id", requireClientId());
        addClientSecret(form);

        return postTokenRequest(form)
                .map(response -> current.refreshedWith(response, clock.instant()))
                .flatMap(refreshed -> saveRecord(refreshed).thenReturn(refreshed))
                .doOnNext(refreshed -> log.info("{} token refreshed successfully", provider))
                .onErrorResume(e -> !(e instanceof ConfigurationException),
                        e -> {
                            log.error("{} token refresh failed: {}", provider, e.getMessage());
                            return this.<TokenRecord>discard(AuthenticationException.refreshFailed(provider, e));
                        });
    }

    private <T> Mono<T> discard(AuthenticationException failure) {
        return deleteRecord().then(Mono.error(failure));
    }

    /**
     * Run the interactive authorization-code flow and persist the resulting credential.
     * Waits for the browser redirect without a deadline; the token exchange itself is bounded.
     */
    public Mono<TokenRecord> login() {
        String clientId = requireClientId();
        String state = randomState();
        PkceChallenge pkce = oauth.isPkce() ? PkceChallenge.generate() : null;

        log.info("Starting {} authentication...", provider);

        return Mono.usingWhen(
                OAuthCallbackServer.start(provider, oauth.getRedirectPort(), oauth.getRedirectPath()),
                server -> {
                    browser.open(buildAuthorizationUrl(clientId, state, pkce));
                    log.info("Waiting for authorization...");
                    return server.awaitCallback()
                            .flatMap(callback -> exchangeCode(verifyCallback(callback, state), pkce));
                },
                OAuthCallbackServer::stop)
                .flatMap(record -> saveRecord(record).thenReturn(record))
                .doOnNext(record -> log.info("{} authentication successful", provider));
    }

    String buildAuthorizationUrl(String clientId, String state, PkceChallenge pkce) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(oauth.getAuthorizationUrl())
                .queryParam("response_type", "code")
                .queryParam("client_id", clientId)
                .queryParam("redirect_uri", oauth.getRedirectUri())
                .queryParam("scope", String.join(" ", oauth.getScopes()))
                .queryParam("state", state);
        if (pkce != null) {
            builder.queryParam("code_challenge", pkce.challenge())
                    .queryParam("code_challenge_method", PkceChallenge.METHOD);
        }
        for (Map.Entry<String, String> param : oauth.getExtraParams().entrySet()) {
            builder.queryParam(param.getKey(), param.getValue());
        }
        return builder.encode().build().toUriString();
    }

    private String verifyCallback(OAuthCallbackServer.Callback callback, String expectedState) {
        if (callback.error() != null) {
            throw new AuthenticationException(provider, AuthenticationException.Reason.AUTHORIZATION_FAILED,
                    "Authorization failed: " + callback.error());
        }
        if (callback.code() == null) {
            throw new AuthenticationException(provider, AuthenticationException.Reason.AUTHORIZATION_FAILED,
                    "Authorization failed or was cancelled");
        }
        if (!expectedState.equals(callback.state())) {
            throw new AuthenticationException(provider, AuthenticationException.Reason.AUTHORIZATION_FAILED,
                    "Authorization state mismatch");
        }
        return callback.code();
    }

    private Mono<TokenRecord> exchangeCode(String code, PkceChallenge pkce) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", oauth.getRedirectUri());
        form.add("client_id", requireClientId());
        addClientSecret(form);
        if (pkce != null) {
            form.add("code_verifier", pkce.verifier());
        }

        return postTokenRequest(form)
                .map(response -> response.toRecord(clock.instant()))
                .onErrorMap(e -> !(e instanceof ConfigurationException),
                        e -> {
                            log.error("Failed to exchange {} code for token: {}", provider, e.getMessage());
                            return new AuthenticationException(provider,
                                    AuthenticationException.Reason.AUTHORIZATION_FAILED,
                                    "Failed to complete " + provider + " authentication", e);
                        });
    }

    private Mono<TokenResponse> postTokenRequest(MultiValueMap<String, String> form) {
        return webClient.post()
                .uri(oauth.getTokenUrl())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(TokenResponse.class)
                .timeout(oauth.getTokenTimeout())
                .flatMap(response -> response.getAccessToken() == null
                        ? Mono.error(new IllegalStateException("Token response carried no access_token"))
                        : Mono.just(response))
                .doOnError(WebClientResponseException.class,
                        e -> log.debug("{} token endpoint answered {}", provider, e.getStatusCode()));
    }

    private void addClientSecret(MultiValueMap<String, String> form) {
        if (oauth.getClientSecret() != null && !oauth.getClientSecret().isBlank()) {
            form.add("client_secret", oauth.getClientSecret());
        }
    }

    private String requireClientId() {
        if (oauth.getClientId() == null || oauth.getClientId().isBlank()) {
            throw new ConfigurationException("OAuth client id for provider '" + provider + "' is not configured");
        }
        return oauth.getClientId();
    }

    /**
     * Current credential state without contacting the provider.
     */
    public Mono<CredentialStatus> status() {
        return loadRecord()
                .map(record -> new CredentialStatus(provider,
                        record.isValidAt(clock.instant()) ? CredentialStatus.State.VALID : CredentialStatus.State.STALE,
                        record.getExpiresAt() != null ? Instant.ofEpochMilli(record.getExpiresAt()) : null))
                .defaultIfEmpty(new CredentialStatus(provider, CredentialStatus.State.UNAUTHENTICATED, null))
                .onErrorResume(CredentialStoreException.class, e -> {
                    log.warn("Stored {} credential is unreadable: {}", provider, e.getMessage());
                    return Mono.just(new CredentialStatus(provider, CredentialStatus.State.UNAUTHENTICATED, null));
                });
    }

    public Mono<Void> logout() {
        return deleteRecord().doOnSuccess(v -> log.info("{} credential removed", provider));
    }

    private Mono<TokenRecord> loadRecord() {
        return Mono.fromCallable(() -> store.load(provider))
                .subscribeOn(Schedulers.boundedElastic())
                .mapNotNull(stored -> stored.orElse(null));
    }

    private Mono<Void> saveRecord(TokenRecord record) {
        return Mono.<Void>fromCallable(() -> {
                    store.save(provider, record);
                    return null;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> deleteRecord() {
        return Mono.<Void>fromCallable(() -> {
                    store.delete(provider);
                    return null;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static String randomState() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }
}
