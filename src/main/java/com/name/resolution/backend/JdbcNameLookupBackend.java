package com.name.resolution.backend;

import com.name.resolution.core.model.ClusterInfo;
import com.name.resolution.core.model.TenantInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of {@link NameLookupBackend} over the {@code clusters},
 * {@code tenants} and {@code premium_cluster_details} tables.
 * All statements are read-only and bounded by the configured query timeout.
 *
 * <p>Always reports itself available once constructed; a database that is down
 * surfaces as failing queries, which the fallback chain absorbs.</p>
 */
public class JdbcNameLookupBackend implements NameLookupBackend {
    private static final Logger log = LoggerFactory.getLogger(JdbcNameLookupBackend.class);

    static final String CLUSTER_BY_ID = """
            SELECT c.cluster_id, c.cluster_name, c.tenant_id,
                   COALESCE(NULLIF(c.tenant_name, ''), t.tenant_name, '') AS tenant_name,
                   COALESCE(c.deploy_type, '') AS deploy_type,
                   COALESCE(c.version, '') AS version,
                   COALESCE(c.cluster_lifecycle, '') AS cluster_lifecycle,
                   COALESCE(c.creation_duration, '') AS creation_duration,
                   COALESCE(c.tenant_plan, '') AS tenant_plan,
                   COALESCE(c.provider, '') AS provider,
                   COALESCE(c.region, '') AS region,
                   COALESCE(c.project_id, '') AS project_id,
                   COALESCE(c.org_id, '') AS org_id,
                   COALESCE(c.cluster_type, '') AS cluster_type,
                   c.created_at, c.updated_at
            FROM clusters c
            LEFT JOIN tenants t ON c.tenant_id = t.tenant_id
            WHERE c.cluster_id = ?""";

    static final String TENANT_BY_ID =
            "SELECT tenant_id, tenant_name, kind, created_at, updated_at FROM tenants WHERE tenant_id = ?";

    static final String TENANT_NAME_BY_ID = "SELECT tenant_name FROM tenants WHERE tenant_id = ?";

    static final String CLUSTER_NAME_BY_ID = "SELECT cluster_name FROM clusters WHERE cluster_id = ?";

    static final String PREMIUM_NAMES_BY_PARENT_ID =
            "SELECT name FROM premium_cluster_details WHERE parent_id = ? AND name <> '' ORDER BY created DESC";

    private final DataSource dataSource;
    private final BackendConfig config;

    public JdbcNameLookupBackend(DataSource dataSource, BackendConfig config) {
        this.dataSource = dataSource;
        this.config = config;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public boolean ping() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(config.queryTimeoutSeconds());
        } catch (SQLException e) {
            log.warn("backend.unavailable error={}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<ClusterInfo> findCluster(String clusterId) {
        return queryOne(CLUSTER_BY_ID, clusterId, rs -> new ClusterInfo(
                rs.getString("cluster_id"),
                nullToEmpty(rs.getString("cluster_name")),
                nullToEmpty(rs.getString("tenant_id")),
                rs.getString("tenant_name"),
                rs.getString("deploy_type"),
                rs.getString("version"),
                rs.getString("cluster_lifecycle"),
                rs.getString("creation_duration"),
                rs.getString("tenant_plan"),
                rs.getString("provider"),
                rs.getString("region"),
                rs.getString("project_id"),
                rs.getString("org_id"),
                rs.getString("cluster_type"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))));
    }

    @Override
    public Optional<TenantInfo> findTenant(String tenantId) {
        return queryOne(TENANT_BY_ID, tenantId, rs -> new TenantInfo(
                rs.getString("tenant_id"),
                nullToEmpty(rs.getString("tenant_name")),
                nullToEmpty(rs.getString("kind")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at"))));
    }

    @Override
    public Optional<String> findTenantName(String tenantId) {
        return queryOne(TENANT_NAME_BY_ID, tenantId, rs -> nullToEmpty(rs.getString(1)));
    }

    @Override
    public Optional<String> findClusterName(String clusterId) {
        return queryOne(CLUSTER_NAME_BY_ID, clusterId, rs -> nullToEmpty(rs.getString(1)));
    }

    @Override
    public List<String> findPremiumClusterNames(String parentId) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = prepare(connection, PREMIUM_NAMES_BY_PARENT_ID, parentId);
             ResultSet rs = statement.executeQuery()) {
            List<String> names = new ArrayList<>();
            while (rs.next()) {
                names.add(nullToEmpty(rs.getString(1)));
            }
            return names;
        } catch (SQLException e) {
            throw new BackendQueryException("Premium cluster name query failed for parent " + parentId, e);
        }
    }

    private <T> Optional<T> queryOne(String sql, String id, RowMapper<T> mapper) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = prepare(connection, sql, id);
             ResultSet rs = statement.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(mapper.map(rs));
        } catch (SQLException e) {
            throw new BackendQueryException("Lookup query failed for id " + id, e);
        }
    }

    private PreparedStatement prepare(Connection connection, String sql, String id) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        try {
            statement.setQueryTimeout(config.queryTimeoutSeconds());
            statement.setString(1, id);
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
