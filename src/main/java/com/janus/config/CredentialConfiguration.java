package com.janus.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.janus.auth.BrowserLauncher;
import com.janus.auth.CredentialStore;
import com.janus.auth.DesktopBrowserLauncher;
import com.janus.auth.OAuthCredentialManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Credential store and one OAuth credential manager per managed provider.
 */
@Configuration
public class CredentialConfiguration {

    public static final String OPENAI = "openai";
    public static final String GEMINI = "gemini";
    public static final String ANTIGRAVITY = "antigravity";

    private final JanusProperties properties;

    public CredentialConfiguration(JanusProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public BrowserLauncher browserLauncher() {
        return new DesktopBrowserLauncher();
    }

    @Bean
    public CredentialStore credentialStore(ObjectMapper objectMapper) {
        JanusProperties.CredentialsConfig credentials = properties.getCredentials();
        return new CredentialStore(Path.of(credentials.getDirectory()),
                credentials.getEncryptionKey(), credentials.getSalt(), objectMapper);
    }

    @Bean
    public OAuthCredentialManager openaiCredentials(CredentialStore store, WebClient webClient,
                                                    BrowserLauncher browser, Clock clock) {
        return manager(OPENAI, store, webClient, browser, clock);
    }

    @Bean
    public OAuthCredentialManager geminiCredentials(CredentialStore store, WebClient webClient,
                                                    BrowserLauncher browser, Clock clock) {
        return manager(GEMINI, store, webClient, browser, clock);
    }

    @Bean
    public OAuthCredentialManager antigravityCredentials(CredentialStore store, WebClient webClient,
                                                         BrowserLauncher browser, Clock clock) {
        return manager(ANTIGRAVITY, store, webClient, browser, clock);
    }

    private OAuthCredentialManager manager(String provider, CredentialStore store, WebClient webClient,
                                           BrowserLauncher browser, Clock clock) {
        return new OAuthCredentialManager(provider, properties.provider(provider).getOauth(),
                store, webClient, browser, clock);
    }
}
