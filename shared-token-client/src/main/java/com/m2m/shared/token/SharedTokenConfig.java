package com.m2m.shared.token;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SharedTokenConfig {

    private URI tokenUrl;
    private String clientId;
    private String clientSecret;
    private String refreshToken;
    private String providerId = "zoho";
    private Duration skew = Duration.ofSeconds(120);
    private Duration cooldown = Duration.ofSeconds(60);
    private Duration pollInterval = Duration.ofMillis(500);
    private int pollAttempts = 30;
    private Duration fallbackLifetime = Duration.ofMinutes(50);
    private Duration requestTimeout = Duration.ofSeconds(15);

    public String lockKey() {
        return "oauth-refresh:" + providerId;
    }

    public SharedTokenConfig validate() {
        require(tokenUrl, "tokenUrl");
        require(clientId, "clientId");
        require(clientSecret, "clientSecret");
        require(refreshToken, "refreshToken");
        require(providerId, "providerId");
        if (pollAttempts < 1) {
            throw new IllegalStateException("pollAttempts must be positive: " + pollAttempts);
        }
        return this;
    }

    /**
     * Reads {@code <PREFIX>_REFRESH_TOKEN}, {@code <PREFIX>_CLIENT_ID} and {@code <PREFIX>_CLIENT_SECRET}
     * (each also accepted as {@code REACT_APP_<PREFIX>_...}), plus {@code <PREFIX>_DC} or
     * {@code <PREFIX>_TOKEN_URL} for the accounts endpoint.
     */
    public static SharedTokenConfig fromEnvironment(Map<String, String> env, String prefix) {
        SharedTokenConfig config = new SharedTokenConfig();
        config.setRefreshToken(required(env, prefix, "REFRESH_TOKEN"));
        config.setClientId(required(env, prefix, "CLIENT_ID"));
        config.setClientSecret(required(env, prefix, "CLIENT_SECRET"));

        String explicitUrl = env.get(prefix + "_TOKEN_URL");
        if (explicitUrl != null && !explicitUrl.isBlank()) {
            config.setTokenUrl(URI.create(explicitUrl.trim()));
        } else {
            String dc = env.getOrDefault(prefix + "_DC", "com");
            config.setTokenUrl(URI.create("https://accounts.zoho." + (dc.isBlank() ? "com" : dc.trim()) + "/oauth/v2/token"));
        }
        config.setProviderId(prefix.toLowerCase());
        return config;
    }

    private static String required(Map<String, String> env, String prefix, String name) {
        String primary = prefix + "_" + name;
        String value = env.get(primary);
        if (value == null || value.isBlank()) {
            value = env.get("REACT_APP_" + primary);
        }
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing environment variable " + primary);
        }
        return value.trim();
    }

    private static void require(Object value, String name) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw new IllegalStateException("Missing shared token setting: " + name);
        }
    }
}
