package com.m2m.shared.token.postgres;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.net.URI;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;

import com.m2m.shared.token.InMemoryTokenStateStore;
import com.m2m.shared.token.RateLimitedException;
import com.m2m.shared.token.RefreshedToken;
import com.m2m.shared.token.SharedTokenConfig;
import com.m2m.shared.token.SharedTokenCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Session handling of {@link PostgresAdvisoryMutex} against a scripted JDBC driver, no database needed.
 */
class PostgresAdvisoryMutexSessionTest {

    private ScriptedDataSource database;
    private ExecutorService other;

    @BeforeEach
    void setUp() {
        database = new ScriptedDataSource();
        other = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        other.shutdownNow();
    }

    @Test
    void releaseByNonOwnerIsNoOp() throws Exception {
        PostgresAdvisoryMutex mutex = new PostgresAdvisoryMutex(database.proxy());

        assertTrue(mutex.tryAcquire("k"));
        other.submit(() -> mutex.release("k")).get();

        assertEquals(0, database.unlocks.get());
        assertEquals(0, database.closed.get());

        mutex.release("k");
        assertEquals(1, database.unlocks.get());
        assertEquals(1, database.closed.get());
    }

    @Test
    void failedUnlockStillClosesSessionWithoutThrowing() {
        database.failUnlock.set(true);
        PostgresAdvisoryMutex mutex = new PostgresAdvisoryMutex(database.proxy());

        assertTrue(mutex.tryAcquire("k"));
        mutex.release("k");

        assertEquals(1, database.unlocks.get());
        assertEquals(1, database.closed.get());
        assertTrue(mutex.tryAcquire("k"));
    }

    @Test
    void failedUnlockDoesNotMaskRefreshedToken() {
        database.failUnlock.set(true);
        InMemoryTokenStateStore store = new InMemoryTokenStateStore();
        SharedTokenCoordinator coordinator = new SharedTokenCoordinator(store,
            new PostgresAdvisoryMutex(database.proxy()),
            (refreshToken, clientId, clientSecret) -> new RefreshedToken("fresh", Duration.ofHours(1)),
            config());

        assertEquals("fresh", coordinator.getSharedAccessToken());
        assertEquals("fresh", store.readToken().orElseThrow().accessToken());
    }

    @Test
    void failedUnlockDoesNotMaskProviderThrottling() {
        database.failUnlock.set(true);
        SharedTokenCoordinator coordinator = new SharedTokenCoordinator(new InMemoryTokenStateStore(),
            new PostgresAdvisoryMutex(database.proxy()),
            (refreshToken, clientId, clientSecret) -> {
                throw new RateLimitedException(Duration.ZERO);
            },
            config());

        RateLimitedException ex = assertThrows(RateLimitedException.class, coordinator::getSharedAccessToken);
        assertEquals(60_000, ex.retryAfterMs());
    }

    private static SharedTokenConfig config() {
        SharedTokenConfig config = new SharedTokenConfig();
        config.setTokenUrl(URI.create("http://localhost/oauth/v2/token"));
        config.setClientId("client");
        config.setClientSecret("secret");
        config.setRefreshToken("refresh");
        return config;
    }

    /**
     * Grants every try-lock and counts unlocks and closed sessions.
     */
    private static final class ScriptedDataSource {

        final AtomicInteger unlocks = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final AtomicBoolean failUnlock = new AtomicBoolean();

        DataSource proxy() {
            return proxy(DataSource.class, (self, method, args) -> {
                if ("getConnection".equals(method.getName())) {
                    return connection();
                }
                throw new UnsupportedOperationException(method.getName());
            });
        }

        private Connection connection() {
            return proxy(Connection.class, (self, method, args) -> {
                switch (method.getName()) {
                    case "prepareStatement":
                        return statement((String) args[0]);
                    case "close":
                        closed.incrementAndGet();
                        return null;
                    default:
                        throw new UnsupportedOperationException(method.getName());
                }
            });
        }

        private PreparedStatement statement(String sql) {
            boolean unlock = sql.contains("pg_advisory_unlock");
            return proxy(PreparedStatement.class, (self, method, args) -> {
                switch (method.getName()) {
                    case "setInt":
                    case "close":
                        return null;
                    case "executeQuery":
                        if (unlock) {
                            unlocks.incrementAndGet();
                            if (failUnlock.get()) {
                                throw new SQLException("connection reset");
                            }
                        }
                        return resultSet();
                    default:
                        throw new UnsupportedOperationException(method.getName());
                }
            });
        }

        private ResultSet resultSet() {
            return proxy(ResultSet.class, (self, method, args) -> {
                switch (method.getName()) {
                    case "next":
                    case "getBoolean":
                        return true;
                    case "close":
                        return null;
                    default:
                        throw new UnsupportedOperationException(method.getName());
                }
            });
        }

        private static <T> T proxy(Class<T> type, InvocationHandler handler) {
            InvocationHandler withIdentity = (self, method, args) -> {
                switch (method.getName()) {
                    case "equals":
                        return self == args[0];
                    case "hashCode":
                        return System.identityHashCode(self);
                    case "toString":
                        return "scripted " + type.getSimpleName();
                    default:
                        return handler.invoke(self, method, args);
                }
            };
            return type.cast(Proxy.newProxyInstance(
                PostgresAdvisoryMutexSessionTest.class.getClassLoader(), new Class<?>[] {type}, withIdentity));
        }
    }
}
