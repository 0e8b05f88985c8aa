package com.m2m.shared.token;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable token and cooldown state shared by every instance, bound to one provider identity.
 * Implement this on a store with atomic single-row upserts (database, CAS key/value store, ...).
 */
public interface TokenStateStore {

    /**
     * @return the cooldown end, or {@link Instant#EPOCH} when none was ever written
     */
    Instant readCooldown();

    /**
     * Extends the shared cooldown to {@code until}. An earlier value than the stored one is ignored.
     */
    void writeCooldown(Instant until);

    Optional<CachedToken> readToken();

    /**
     * @throws IllegalArgumentException if the token is empty or the expiry is not a valid instant
     */
    void writeToken(String accessToken, Instant expiresAt);

    /**
     * Forces the stored token's expiry into the past. The record itself is kept.
     */
    void invalidateToken();
}
