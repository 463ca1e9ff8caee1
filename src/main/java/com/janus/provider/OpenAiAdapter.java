package com.janus.provider;

import com.janus.auth.OAuthCredentialManager;
import com.janus.config.CredentialConfiguration;
import com.janus.config.JanusProperties;
import com.janus.transpiler.OpenAiTranspiler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * OpenAI Chat Completions, authenticated with the Codex OAuth credential.
 */
@Order(1)
@Component
public class OpenAiAdapter extends AbstractProviderAdapter {

    public OpenAiAdapter(WebClient webClient,
                         JanusProperties properties,
                         @Qualifier("openaiCredentials") OAuthCredentialManager credentials,
                         OpenAiTranspiler transpiler,
                         ResponseWriter responseWriter) {
        super(CredentialConfiguration.OPENAI, webClient, properties, credentials, transpiler, responseWriter);
    }

    @Override
    public boolean supports(String model) {
        return model != null && OpenAiTranspiler.isNativeModel(model);
    }

    @Override
    protected String endpoint(String providerModel, boolean stream) {
        return config.getBaseUrl() + "/chat/completions";
    }
}
