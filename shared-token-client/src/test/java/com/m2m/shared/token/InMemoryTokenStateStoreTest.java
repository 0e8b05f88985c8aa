package com.m2m.shared.token;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryTokenStateStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryTokenStateStore store = new InMemoryTokenStateStore(clock);

    @Test
    void startsWithoutTokenOrCooldown() {
        assertTrue(store.readToken().isEmpty());
        assertEquals(Instant.EPOCH, store.readCooldown());
    }

    @Test
    void cooldownOnlyMovesForward() {
        store.writeCooldown(NOW.plusSeconds(60));
        store.writeCooldown(NOW.plusSeconds(30));
        assertEquals(NOW.plusSeconds(60), store.readCooldown());

        store.writeCooldown(NOW.plusSeconds(90));
        assertEquals(NOW.plusSeconds(90), store.readCooldown());
    }

    @Test
    void rejectsMalformedTokens() {
        assertThrows(IllegalArgumentException.class, () -> store.writeToken("", NOW.plusSeconds(60)));
        assertThrows(IllegalArgumentException.class, () -> store.writeToken(null, NOW.plusSeconds(60)));
        assertThrows(IllegalArgumentException.class, () -> store.writeToken("t", null));
        assertThrows(IllegalArgumentException.class, () -> store.writeToken("t", Instant.EPOCH));
        assertTrue(store.readToken().isEmpty());
    }

    @Test
    void invalidateKeepsRecordButExpiresIt() {
        store.writeToken("t", NOW.plusSeconds(3600));

        store.invalidateToken();

        CachedToken token = store.readToken().orElseThrow();
        assertEquals("t", token.accessToken());
        assertEquals(NOW.minus(Duration.ofDays(1)), token.expiresAt());
        assertFalse(token.isValidAt(NOW));
    }

    @Test
    void invalidateWithoutTokenIsNoOp() {
        store.invalidateToken();

        assertTrue(store.readToken().isEmpty());
    }

    @Test
    void cachedTokenHidesSecretInToString() {
        assertFalse(new CachedToken("secret-value", NOW).toString().contains("secret-value"));
    }
}
