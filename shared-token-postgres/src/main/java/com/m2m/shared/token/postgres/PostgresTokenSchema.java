package com.m2m.shared.token.postgres;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;

import com.m2m.shared.token.TokenStoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates {@code oauth_tokens} and {@code oauth_state} if they do not exist yet.
 */
@Slf4j
public final class PostgresTokenSchema {

    static final String SCRIPT = "db/shared-token-schema.sql";

    private PostgresTokenSchema() {}

    public static void apply(DataSource dataSource) {
        String ddl = loadScript();
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            log.info("Shared token schema is in place");
        } catch (SQLException e) {
            throw new TokenStoreException("Failed to apply shared token schema", e);
        }
    }

    private static String loadScript() {
        try (InputStream in = PostgresTokenSchema.class.getClassLoader().getResourceAsStream(SCRIPT)) {
            if (in == null) {
                throw new IllegalStateException("Schema script not found on classpath: " + SCRIPT);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + SCRIPT, e);
        }
    }
}
