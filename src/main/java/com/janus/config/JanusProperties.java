package com.janus.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the Janus gateway.
 */
@Data
@Component
@ConfigurationProperties(prefix = "janus")
public class JanusProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private CredentialsConfig credentials = new CredentialsConfig();
    private RoutingConfig routing = new RoutingConfig();
    private AnthropicConfig anthropic = new AnthropicConfig();
    private ModelsConfig models = new ModelsConfig();

    /**
     * Look up a provider section, falling back to an empty one so that a missing
     * section only surfaces when the provider is actually used.
     */
    public ProviderConfig provider(String name) {
        return providers.getOrDefault(name, new ProviderConfig());
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(30);
        // Cloud Code project, resolved through loadCodeAssist when blank
        private String projectId;
        private OAuthConfig oauth = new OAuthConfig();
    }

    @Data
    public static class OAuthConfig {
        private String clientId;
        private String clientSecret;
        private String authorizationUrl;
        private String tokenUrl;
        private int redirectPort;
        private String redirectPath = "/oauth-callback";
        private List<String> scopes = new ArrayList<>();
        private boolean pkce;
        private Map<String, String> extraParams = new LinkedHashMap<>();
        private Duration tokenTimeout = Duration.ofSeconds(30);

        public String getRedirectUri() {
            return "http://localhost:" + redirectPort + redirectPath;
        }
    }

    @Data
    public static class CredentialsConfig {
        private String directory = System.getProperty("user.home") + "/.janus";
        private String encryptionKey;
        private String salt;
    }

    @Data
    public static class RoutingConfig {
        // canonical model id -> provider adapter name
        private Map<String, String> aliases = new LinkedHashMap<>();
    }

    @Data
    public static class AnthropicConfig {
        private boolean enabled = true;
        private String baseUrl = "https://api.anthropic.com";
        private String defaultVersion = "2023-06-01";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class ModelsConfig {
        private Duration cacheTtl = Duration.ofHours(1);
        private List<String> geminiModels = new ArrayList<>();
        private List<String> antigravityModels = new ArrayList<>();
    }
}
