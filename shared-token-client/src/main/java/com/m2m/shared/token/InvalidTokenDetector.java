package com.m2m.shared.token;

import java.util.Locale;

@FunctionalInterface
public interface InvalidTokenDetector {

    boolean isInvalidToken(Throwable failure);

    /**
     * HTTP 401 whose error marker contains {@code marker}, ignoring case.
     */
    static InvalidTokenDetector unauthorizedWithMarker(String marker) {
        String needle = marker.toLowerCase(Locale.ROOT);
        return failure -> failure instanceof ProviderApiException e
            && e.getStatus() == 401
            && e.getCode() != null
            && e.getCode().toLowerCase(Locale.ROOT).contains(needle);
    }

    static InvalidTokenDetector zohoInvalidOAuthToken() {
        return unauthorizedWithMarker("INVALID_OAUTHTOKEN");
    }
}
