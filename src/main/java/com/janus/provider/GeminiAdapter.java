package com.janus.provider;

import com.janus.auth.OAuthCredentialManager;
import com.janus.config.CredentialConfiguration;
import com.janus.config.JanusProperties;
import com.janus.transpiler.GeminiTranspiler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Google Generative Language API with a Google OAuth credential.
 */
@Order(3)
@Component
public class GeminiAdapter extends AbstractProviderAdapter {

    public GeminiAdapter(WebClient webClient,
                         JanusProperties properties,
                         @Qualifier("geminiCredentials") OAuthCredentialManager credentials,
                         GeminiTranspiler transpiler,
                         ResponseWriter responseWriter) {
        super(CredentialConfiguration.GEMINI, webClient, properties, credentials, transpiler, responseWriter);
    }

    @Override
    public boolean supports(String model) {
        return model != null && model.startsWith("gemini");
    }

    @Override
    protected String endpoint(String providerModel, boolean stream) {
        return config.getBaseUrl() + "/models/" + providerModel
                + (stream ? ":streamGenerateContent?alt=sse" : ":generateContent");
    }
}
