package com.m2m.shared.token.postgres;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

import com.m2m.shared.token.CachedToken;
import com.m2m.shared.token.TokenStateStore;
import com.m2m.shared.token.TokenStoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * Token and cooldown rows keyed by provider, written with single-statement {@code ON CONFLICT} upserts.
 */
@Slf4j
public class PostgresTokenStateStore implements TokenStateStore {

    private static final Duration INVALIDATION_OFFSET = Duration.ofDays(1);

    private static final String SELECT_COOLDOWN_SQL =
        "SELECT backoff_until FROM oauth_state WHERE provider = ?";

    // GREATEST ignores NULL, so a fresh row or a cleared value never blocks an extension
    private static final String UPSERT_COOLDOWN_SQL = """
        INSERT INTO oauth_state (provider, backoff_until, updated_at)
        VALUES (?, ?, NOW())
        ON CONFLICT (provider) DO UPDATE
          SET backoff_until = GREATEST(oauth_state.backoff_until, EXCLUDED.backoff_until),
              updated_at = NOW()
        """;

    private static final String SELECT_TOKEN_SQL =
        "SELECT access_token, expires_at FROM oauth_tokens WHERE provider = ?";

    private static final String UPSERT_TOKEN_SQL = """
        INSERT INTO oauth_tokens (provider, access_token, expires_at, updated_at)
        VALUES (?, ?, ?, NOW())
        ON CONFLICT (provider) DO UPDATE
          SET access_token = EXCLUDED.access_token,
              expires_at = EXCLUDED.expires_at,
              updated_at = NOW()
        """;

    private static final String INVALIDATE_TOKEN_SQL =
        "UPDATE oauth_tokens SET expires_at = ?, updated_at = NOW() WHERE provider = ?";

    private final DataSource dataSource;
    private final String provider;
    private final Clock clock;

    public PostgresTokenStateStore(DataSource dataSource, String provider) {
        this(dataSource, provider, Clock.systemUTC());
    }

    public PostgresTokenStateStore(DataSource dataSource, String provider, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.provider = requireNonBlank(provider, "provider");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Instant readCooldown() {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(SELECT_COOLDOWN_SQL)) {
            ps.setString(1, provider);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Instant.EPOCH;
                }
                Timestamp until = rs.getTimestamp(1);
                return until == null ? Instant.EPOCH : until.toInstant();
            }
        } catch (SQLException e) {
            throw new TokenStoreException("Failed to read cooldown for " + provider, e);
        }
    }

    @Override
    public void writeCooldown(Instant until) {
        if (until == null) {
            throw new IllegalArgumentException("Invalid cooldown: null");
        }
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(UPSERT_COOLDOWN_SQL)) {
            ps.setString(1, provider);
            ps.setTimestamp(2, Timestamp.from(until));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new TokenStoreException("Failed to write cooldown for " + provider, e);
        }
    }

    @Override
    public Optional<CachedToken> readToken() {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(SELECT_TOKEN_SQL)) {
            ps.setString(1, provider);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CachedToken(rs.getString(1), rs.getTimestamp(2).toInstant()));
            }
        } catch (SQLException e) {
            throw new TokenStoreException("Failed to read token for " + provider, e);
        }
    }

    @Override
    public void writeToken(String accessToken, Instant expiresAt) {
        CachedToken token = new CachedToken(accessToken, expiresAt);
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(UPSERT_TOKEN_SQL)) {
            ps.setString(1, provider);
            ps.setString(2, token.accessToken());
            ps.setTimestamp(3, Timestamp.from(token.expiresAt()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new TokenStoreException("Failed to write token for " + provider, e);
        }
    }

    @Override
    public void invalidateToken() {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(INVALIDATE_TOKEN_SQL)) {
            ps.setTimestamp(1, Timestamp.from(clock.instant().minus(INVALIDATION_OFFSET)));
            ps.setString(2, provider);
            int updated = ps.executeUpdate();
            log.debug("Invalidated {} token row(s) for {}", updated, provider);
        } catch (SQLException e) {
            throw new TokenStoreException("Failed to invalidate token for " + provider, e);
        }
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
