package com.m2m.shared.token;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

/**
 * Hands out the shared upstream access token to any number of stateless instances.
 * <p>
 * All coordination goes through the {@link TokenStateStore} and the {@link DistributedMutex}:
 * only the lock holder talks to the token endpoint, everybody else reuses the cached token,
 * waits briefly for the holder, or backs off while a provider cooldown is active.
 */
@Slf4j
public class SharedTokenCoordinator {

    private final TokenStateStore store;
    private final DistributedMutex mutex;
    private final TokenRefresher refresher;
    private final SharedTokenConfig config;
    private final Clock clock;

    public SharedTokenCoordinator(TokenStateStore store,
                                  DistributedMutex mutex,
                                  TokenRefresher refresher,
                                  SharedTokenConfig config) {
        this(store, mutex, refresher, config, Clock.systemUTC());
    }

    public SharedTokenCoordinator(TokenStateStore store,
                                  DistributedMutex mutex,
                                  TokenRefresher refresher,
                                  SharedTokenConfig config,
                                  Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.mutex = Objects.requireNonNull(mutex, "mutex");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return a bearer token valid for at least the configured skew
     * @throws RateLimitedException   while a cooldown is active, when the provider throttles the refresh,
     *                                or when another instance's refresh did not finish in time
     * @throws RefreshFailedException if this instance's refresh was rejected
     */
    public String getSharedAccessToken() {
        failIfCoolingDown();

        Optional<String> cached = validToken();
        if (cached.isPresent()) {
            log.debug("Using cached {} token", config.getProviderId());
            return cached.get();
        }

        String lockKey = config.lockKey();
        if (!mutex.tryAcquire(lockKey)) {
            log.debug("Refresh of {} token in progress elsewhere, waiting", config.getProviderId());
            return awaitOtherRefresh();
        }

        try {
            return refreshHoldingLock();
        } finally {
            mutex.release(lockKey);
        }
    }

    /**
     * Expires the shared token so the next call refreshes it. Does not take the lock.
     */
    public void invalidate() {
        log.info("Invalidating cached {} token", config.getProviderId());
        store.invalidateToken();
    }

    public TokenStatus status() {
        Instant now = clock.instant();
        Instant backoffUntil = store.readCooldown();
        Duration remaining = now.isBefore(backoffUntil) ? Duration.between(now, backoffUntil) : Duration.ZERO;
        boolean cached = store.readToken().map(t -> t.isValidAt(now)).orElse(false);
        return new TokenStatus(cached, remaining, now);
    }

    private String refreshHoldingLock() {
        // the previous holder may have finished between our cache check and the acquire
        failIfCoolingDown();
        Optional<String> current = validToken();
        if (current.isPresent()) {
            return current.get();
        }

        RefreshedToken refreshed;
        try {
            refreshed = refresher.refresh(config.getRefreshToken(), config.getClientId(), config.getClientSecret());
        } catch (RateLimitedException e) {
            Duration cooldown = config.getCooldown();
            store.writeCooldown(clock.instant().plus(cooldown));
            log.warn("Provider {} throttled the token refresh, cooling down for {} ms",
                config.getProviderId(), cooldown.toMillis());
            throw new RateLimitedException(cooldown);
        }

        Instant expiresAt = clock.instant().plus(refreshed.lifetime()).minus(config.getSkew());
        store.writeToken(refreshed.accessToken(), expiresAt);
        log.info("Refreshed {} token, valid until {}", config.getProviderId(), expiresAt);
        return refreshed.accessToken();
    }

    private String awaitOtherRefresh() {
        for (int i = 0; i < config.getPollAttempts(); i++) {
            try {
                Thread.sleep(config.getPollInterval().toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new RefreshFailedException("Interrupted while waiting for token refresh", ie);
            }
            failIfCoolingDown();
            Optional<String> token = validToken();
            if (token.isPresent()) {
                return token.get();
            }
        }
        log.warn("Gave up waiting for the {} token refresh after {} attempts",
            config.getProviderId(), config.getPollAttempts());
        throw new RateLimitedException(config.getCooldown());
    }

    private void failIfCoolingDown() {
        Instant now = clock.instant();
        Instant backoffUntil = store.readCooldown();
        if (now.isBefore(backoffUntil)) {
            throw new RateLimitedException(Duration.between(now, backoffUntil));
        }
    }

    private Optional<String> validToken() {
        Instant now = clock.instant();
        return store.readToken()
            .filter(t -> t.isValidAt(now))
            .map(CachedToken::accessToken);
    }
}
