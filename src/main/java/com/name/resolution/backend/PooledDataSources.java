package com.name.resolution.backend;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the pooled {@link javax.sql.DataSource} behind {@link JdbcNameLookupBackend}.
 *
 * <p>Connections are read-only. The pool does not fail when the database is unreachable
 * at startup; it keeps trying in the background while lookups fail and fall back to ids.
 * The caller owns the returned pool and must close it.</p>
 */
public final class PooledDataSources {
    private static final Logger log = LoggerFactory.getLogger(PooledDataSources.class);

    static final String POOL_NAME = "name-resolution-lookup";

    private PooledDataSources() {
    }

    public static HikariDataSource create(String jdbcUrl, String username, String password, PoolConfig poolConfig) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl is required");
        }
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(POOL_NAME);
        hikari.setJdbcUrl(jdbcUrl);
        hikari.setUsername(username);
        hikari.setPassword(password);
        hikari.setReadOnly(true);
        hikari.setMaximumPoolSize(poolConfig.getMaxPoolSize());
        hikari.setMinimumIdle(poolConfig.getMinIdle());
        hikari.setMaxLifetime(poolConfig.getMaxLifetime().toMillis());
        hikari.setConnectionTimeout(poolConfig.getConnectionTimeout().toMillis());
        hikari.setInitializationFailTimeout(-1);

        log.info("Lookup connection pool configured: {}", poolConfig);
        return new HikariDataSource(hikari);
    }
}
