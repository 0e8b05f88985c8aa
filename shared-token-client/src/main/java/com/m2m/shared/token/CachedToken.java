package com.m2m.shared.token;

import java.time.Instant;

/**
 * Access token as stored in the shared state. {@code expiresAt} already has the skew subtracted.
 */
public record CachedToken(String accessToken, Instant expiresAt) {

    public CachedToken {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Invalid access token: must not be empty");
        }
        if (expiresAt == null || !expiresAt.isAfter(Instant.EPOCH)) {
            throw new IllegalArgumentException("Invalid expiresAt: " + expiresAt);
        }
    }

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "CachedToken[expiresAt=" + expiresAt + "]";
    }
}
