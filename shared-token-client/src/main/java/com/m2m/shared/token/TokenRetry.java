package com.m2m.shared.token;

import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs upstream calls with the shared token and recovers once from a token the provider revoked.
 */
@Slf4j
public class TokenRetry {

    private final SharedTokenCoordinator coordinator;
    private final InvalidTokenDetector detector;

    public TokenRetry(SharedTokenCoordinator coordinator) {
        this(coordinator, InvalidTokenDetector.zohoInvalidOAuthToken());
    }

    public TokenRetry(SharedTokenCoordinator coordinator, InvalidTokenDetector detector) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.detector = Objects.requireNonNull(detector, "detector");
    }

    /**
     * Calls {@code call} with the shared token. If it fails because the token is no longer valid,
     * the cached token is invalidated and the call is repeated exactly once with a fresh one.
     */
    public <T, X extends Exception> T withTokenRetry(TokenCall<T, X> call) throws X {
        String token = coordinator.getSharedAccessToken();
        try {
            return call.call(token);
        } catch (Exception e) {
            if (!detector.isInvalidToken(e)) {
                throw e;
            }
            log.info("Provider rejected the shared token, refreshing and retrying once");
        }
        coordinator.invalidate();
        String fresh = coordinator.getSharedAccessToken();
        return call.call(fresh);
    }
}
