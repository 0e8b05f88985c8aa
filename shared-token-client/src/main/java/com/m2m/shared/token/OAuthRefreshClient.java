package com.m2m.shared.token;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Refresh-token grant against the provider's token endpoint. One HTTP round-trip per call, no retries.
 */
@Slf4j
public class OAuthRefreshClient implements TokenRefresher {

    private static final String RATE_LIMIT_MARKER = "too many requests";

    private final HttpClient http;
    private final URI tokenUrl;
    private final Duration timeout;
    private final Duration fallbackLifetime;
    private final ObjectMapper mapper;

    public OAuthRefreshClient(HttpClient http, SharedTokenConfig config) {
        this(http, config.getTokenUrl(), config.getRequestTimeout(), config.getFallbackLifetime(),
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public OAuthRefreshClient(HttpClient http,
                              URI tokenUrl,
                              Duration timeout,
                              Duration fallbackLifetime,
                              ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http");
        this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
        this.timeout = timeout == null ? Duration.ofSeconds(15) : timeout;
        this.fallbackLifetime = fallbackLifetime == null ? Duration.ofMinutes(50) : fallbackLifetime;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public RefreshedToken refresh(String refreshToken, String clientId, String clientSecret) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("refresh_token", Objects.requireNonNull(refreshToken, "refreshToken"));
        params.put("client_id", Objects.requireNonNull(clientId, "clientId"));
        params.put("client_secret", Objects.requireNonNull(clientSecret, "clientSecret"));
        params.put("grant_type", "refresh_token");

        HttpRequest req = HttpRequest.newBuilder(tokenUrl)
            .timeout(timeout)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(params)))
            .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RefreshFailedException("Interrupted while refreshing token", ie);
        } catch (IOException e) {
            log.warn("Token endpoint {} unreachable: {}", tokenUrl, e.getMessage());
            throw new RefreshFailedException("Token endpoint unreachable: " + e.getMessage(), e);
        }

        int sc = resp.statusCode();
        String body = resp.body() == null ? "" : resp.body();
        log.debug("Token endpoint answered HTTP {}", sc);

        if (sc == 429 || body.toLowerCase(Locale.ROOT).contains(RATE_LIMIT_MARKER)) {
            log.warn("Token endpoint is throttling refreshes (HTTP {})", sc);
            throw new RateLimitedException(Duration.ZERO);
        }
        if (sc < 200 || sc >= 300) {
            throw new RefreshFailedException(sc, body);
        }

        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (IOException e) {
            throw new MissingAccessTokenException(sc, body);
        }
        String accessToken = node == null ? null : node.path("access_token").asText(null);
        if (accessToken == null || accessToken.isBlank()) {
            throw new MissingAccessTokenException(sc, body);
        }

        // expires_in may come back as a number or a numeric string
        long expiresIn = node.path("expires_in").asLong(0);
        Duration lifetime = expiresIn > 0 ? Duration.ofSeconds(expiresIn) : fallbackLifetime;
        return new RefreshedToken(accessToken, lifetime);
    }

    private static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }
}
