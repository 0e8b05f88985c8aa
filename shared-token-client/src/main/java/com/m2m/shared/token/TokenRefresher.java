package com.m2m.shared.token;

public interface TokenRefresher {

    /**
     * @throws RateLimitedException        if the provider is throttling
     * @throws MissingAccessTokenException if the response carries no access token
     * @throws RefreshFailedException      for any other rejection or transport failure
     */
    RefreshedToken refresh(String refreshToken, String clientId, String clientSecret);
}
