package com.m2m.shared.token.postgres;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.sql.DataSource;

import com.m2m.shared.token.DistributedMutex;
import com.m2m.shared.token.TokenStoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link DistributedMutex} on PostgreSQL session-level advisory locks.
 * <p>
 * The lock belongs to the database session that took it, so the acquiring connection stays
 * checked out of the pool until {@link #release(String)}. If the process dies the session ends
 * and PostgreSQL drops the lock. Only the thread that acquired a key can release it.
 */
@Slf4j
public class PostgresAdvisoryMutex implements DistributedMutex {

    static final int LOCK_NAMESPACE = 0x5A0;

    private static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(?, ?)";
    private static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(?, ?)";

    private final DataSource dataSource;
    private final ConcurrentMap<String, HeldLock> held = new ConcurrentHashMap<>();

    public PostgresAdvisoryMutex(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public boolean tryAcquire(String key) {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            boolean acquired;
            try (PreparedStatement ps = connection.prepareStatement(TRY_LOCK_SQL)) {
                bindKey(ps, key);
                try (ResultSet rs = ps.executeQuery()) {
                    acquired = rs.next() && rs.getBoolean(1);
                }
            }
            if (acquired && held.putIfAbsent(key, new HeldLock(Thread.currentThread(), connection)) == null) {
                log.debug("Acquired advisory lock {}", key);
                return true;
            }
            if (acquired) {
                unlock(connection, key);
            }
            closeQuietly(connection);
            return false;
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new TokenStoreException("Failed to try advisory lock " + key, e);
        }
    }

    @Override
    public void release(String key) {
        HeldLock lock = held.get(key);
        if (lock == null || lock.owner() != Thread.currentThread() || !held.remove(key, lock)) {
            return;
        }
        try {
            unlock(lock.connection(), key);
            log.debug("Released advisory lock {}", key);
        } catch (SQLException e) {
            // closing the session below drops the lock anyway
            log.warn("Failed to release advisory lock {}, closing its session", key, e);
        } finally {
            closeQuietly(lock.connection());
        }
    }

    static int objectKey(String key) {
        return key.hashCode();
    }

    private static void unlock(Connection connection, String key) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(UNLOCK_SQL)) {
            bindKey(ps, key);
            ps.executeQuery().close();
        }
    }

    private static void bindKey(PreparedStatement ps, String key) throws SQLException {
        ps.setInt(1, LOCK_NAMESPACE);
        ps.setInt(2, objectKey(key));
    }

    private record HeldLock(Thread owner, Connection connection) {
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close advisory lock connection", e);
        }
    }
}
