package com.m2m.shared.token;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import lombok.AllArgsConstructor;

/**
 * Process-local store. Only coordinates callers inside one JVM; use a database-backed store
 * when several instances share the credential.
 */
@AllArgsConstructor
public class InMemoryTokenStateStore implements TokenStateStore {

    private static final Duration INVALIDATION_OFFSET = Duration.ofDays(1);

    private final Clock clock;
    private final AtomicReference<CachedToken> token = new AtomicReference<>();
    private final AtomicReference<Instant> cooldown = new AtomicReference<>(Instant.EPOCH);

    public InMemoryTokenStateStore() {
        this(Clock.systemUTC());
    }

    @Override
    public Instant readCooldown() {
        return cooldown.get();
    }

    @Override
    public void writeCooldown(Instant until) {
        if (until == null) {
            throw new IllegalArgumentException("Invalid cooldown: null");
        }
        cooldown.accumulateAndGet(until, (current, next) -> next.isAfter(current) ? next : current);
    }

    @Override
    public Optional<CachedToken> readToken() {
        return Optional.ofNullable(token.get());
    }

    @Override
    public void writeToken(String accessToken, Instant expiresAt) {
        token.set(new CachedToken(accessToken, expiresAt));
    }

    @Override
    public void invalidateToken() {
        Instant past = clock.instant().minus(INVALIDATION_OFFSET);
        token.updateAndGet(current -> current == null ? null : new CachedToken(current.accessToken(), past));
    }
}
