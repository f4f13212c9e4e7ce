package com.name.resolution.backend;

import com.name.resolution.core.model.TenantInfo;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.hsqldb.jdbc.JDBCDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PooledDataSourcesTest {

    private String jdbcUrl;

    @BeforeEach
    void setUp() throws SQLException {
        jdbcUrl = "jdbc:hsqldb:mem:pooled" + UUID.randomUUID().toString().replace("-", "");
        JDBCDataSource setup = new JDBCDataSource();
        setup.setUrl(jdbcUrl);
        setup.setUser("SA");
        setup.setPassword("");
        try (Connection connection = setup.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE tenants (tenant_id VARCHAR(32) PRIMARY KEY, tenant_name VARCHAR(255), "
                    + "kind VARCHAR(32), created_at TIMESTAMP, updated_at TIMESTAMP)");
            statement.execute("INSERT INTO tenants VALUES ('900', 'Acme Corp', 'enterprise', NULL, NULL)");
        }
    }

    @Nested
    @DisplayName("Pooled data source")
    class PoolTests {

        @Test
        @DisplayName("Should apply the default pool settings")
        void testDefaultSettings() {
            try (HikariDataSource pool = PooledDataSources.create(jdbcUrl, "SA", "", PoolConfig.defaults())) {
                assertEquals(20, pool.getMaximumPoolSize());
                assertEquals(10, pool.getMinimumIdle());
                assertEquals(Duration.ofMinutes(5).toMillis(), pool.getMaxLifetime());
                assertTrue(pool.isReadOnly());
                assertEquals(PooledDataSources.POOL_NAME, pool.getPoolName());
            }
        }

        @Test
        @DisplayName("Repeated lookups should reuse pooled connections")
        void testLookupsShareConnections() {
            PoolConfig config = PoolConfig.builder().maxPoolSize(2).minIdle(1).build();
            try (HikariDataSource pool = PooledDataSources.create(jdbcUrl, "SA", "", config)) {
                JdbcNameLookupBackend backend = new JdbcNameLookupBackend(pool, BackendConfig.defaults());

                for (int i = 0; i < 10; i++) {
                    TenantInfo tenant = backend.findTenant("900").orElseThrow();
                    assertEquals("Acme Corp", tenant.tenantName());
                    assertEquals("", backend.findTenantName("901").orElse(""));
                }

                HikariPoolMXBean stats = pool.getHikariPoolMXBean();
                assertEquals(0, stats.getActiveConnections());
                assertTrue(stats.getTotalConnections() <= 2);
                assertTrue(backend.ping());
            }
        }

        @Test
        @DisplayName("Closing the pool should make further lookups fail as query errors")
        void testClosedPool() {
            HikariDataSource pool = PooledDataSources.create(jdbcUrl, "SA", "", PoolConfig.defaults());
            JdbcNameLookupBackend backend = new JdbcNameLookupBackend(pool, BackendConfig.defaults());

            pool.close();

            assertTrue(pool.isClosed());
            assertThrows(BackendQueryException.class, () -> backend.findTenant("900"));
            assertFalse(backend.ping());
        }

        @Test
        @DisplayName("Should require a JDBC URL")
        void testMissingUrl() {
            assertThrows(IllegalArgumentException.class,
                    () -> PooledDataSources.create(" ", "SA", "", PoolConfig.defaults()));
        }
    }

    @Nested
    @DisplayName("PoolConfig")
    class PoolConfigTests {

        @Test
        @DisplayName("Defaults should be 20 max, 10 idle, 5 minute lifetime")
        void testDefaults() {
            PoolConfig config = PoolConfig.defaults();

            assertEquals(20, config.getMaxPoolSize());
            assertEquals(10, config.getMinIdle());
            assertEquals(Duration.ofMinutes(5), config.getMaxLifetime());
            assertEquals(Duration.ofSeconds(5), config.getConnectionTimeout());
        }

        @Test
        @DisplayName("Should reject invalid settings")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.builder().maxPoolSize(0));
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.builder().minIdle(-1));
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().maxLifetime(Duration.ofSeconds(10)));
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().connectionTimeout(Duration.ofMillis(100)));
            assertThrows(IllegalArgumentException.class,
                    () -> PoolConfig.builder().maxPoolSize(5).minIdle(6).build());
        }
    }
}
