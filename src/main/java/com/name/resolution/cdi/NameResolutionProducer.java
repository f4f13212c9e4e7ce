package com.name.resolution.cdi;

import com.name.resolution.api.NameResolver;
import com.name.resolution.audit.FileMissAuditor;
import com.name.resolution.backend.BackendConfig;
import com.name.resolution.backend.JdbcNameLookupBackend;
import com.name.resolution.backend.NameLookupBackend;
import com.name.resolution.backend.PoolConfig;
import com.name.resolution.backend.PooledDataSources;
import com.name.resolution.backend.UnavailableNameLookupBackend;
import com.name.resolution.cache.CacheConfig;
import com.name.resolution.metrics.MicrometerMetricsService;
import com.name.resolution.tracing.OpenTelemetryTracingService;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires a single {@link NameResolver} from MicroProfile Config properties.
 *
 * <pre>
 * name-resolution:
 *   cache:
 *     ttl-seconds: 86400
 *     not-found-ttl-seconds: 3600
 *     cleanup-interval-seconds: 600
 *   miss-log:
 *     path: name_service_miss.log
 *   backend:
 *     jdbc-url: jdbc:mysql://tidb.example.com:4000/meta?sslMode=VERIFY_IDENTITY
 *     username: reader
 *     password: secret
 *     query-timeout-seconds: 5
 *     pool:
 *       max-size: 20
 *       min-idle: 10
 *       max-lifetime-seconds: 300
 *       connection-timeout-millis: 5000
 * </pre>
 *
 * <p>Without {@code backend.jdbc-url} the resolver still starts; every numeric
 * identifier then resolves to itself with a backend-unavailable error.</p>
 */
@ApplicationScoped
public class NameResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(NameResolutionProducer.class);

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "name-resolution.cache.ttl-seconds", defaultValue = "86400")
    long cacheTtlSeconds;

    @Inject
    @ConfigProperty(name = "name-resolution.cache.not-found-ttl-seconds", defaultValue = "3600")
    long notFoundTtlSeconds;

    @Inject
    @ConfigProperty(name = "name-resolution.cache.cleanup-interval-seconds", defaultValue = "600")
    long cleanupIntervalSeconds;

    // ── Miss log ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "name-resolution.miss-log.path", defaultValue = FileMissAuditor.DEFAULT_PATH)
    String missLogPath;

    // ── Backend ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "name-resolution.backend.jdbc-url")
    Optional<String> jdbcUrl;

    @Inject
    @ConfigProperty(name = "name-resolution.backend.username")
    Optional<String> username;

    @Inject
    @ConfigProperty(name = "name-resolution.backend.password")
    Optional<String> password;

    @Inject
    @ConfigProperty(name = "name-resolution.backend.query-timeout-seconds", defaultValue = "5")
    int queryTimeoutSeconds;

    // ── Connection Pool ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "name-resolution.backend.pool.max-size", defaultValue = "20")
    int poolMaxSize;

    @Inject
    @ConfigProperty(name = "name-resolution.backend.pool.min-idle", defaultValue = "10")
    int poolMinIdle;

    @Inject
    @ConfigProperty(name = "name-resolution.backend.pool.max-lifetime-seconds", defaultValue = "300")
    long poolMaxLifetimeSeconds;

    @Inject
    @ConfigProperty(name = "name-resolution.backend.pool.connection-timeout-millis", defaultValue = "5000")
    long poolConnectionTimeoutMillis;

    // ── Observability ─────────────────────────────────────────

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // Owned here, not by the resolver
    private FileMissAuditor missAuditor;
    private HikariDataSource pooledDataSource;

    @Produces
    @ApplicationScoped
    public NameResolver nameResolver() {
        CacheConfig cacheConfig = new CacheConfig(
                Duration.ofSeconds(cacheTtlSeconds), Duration.ofSeconds(notFoundTtlSeconds));

        missAuditor = new FileMissAuditor(Path.of(missLogPath));

        NameResolver.Builder builder = NameResolver.builder()
                .backend(createBackend())
                .cacheConfig(cacheConfig)
                .missAuditor(missAuditor);

        if (cleanupIntervalSeconds > 0) {
            builder.cleanupInterval(Duration.ofSeconds(cleanupIntervalSeconds));
        } else {
            log.info("Name cache cleanup disabled, expired entries are only removed on demand");
        }
        if (meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
        }
        if (tracer.isResolvable()) {
            builder.tracingService(new OpenTelemetryTracingService(tracer.get()));
        }

        log.info("Producing NameResolver: cacheTtl={} notFoundTtl={} missLog={}",
                cacheConfig.cacheTtl(), cacheConfig.notFoundTtl(), missLogPath);
        return builder.build();
    }

    public void closeResolver(@Disposes NameResolver resolver) {
        log.info("Closing NameResolver");
        resolver.close();
        if (missAuditor != null) {
            missAuditor.close();
        }
        if (pooledDataSource != null) {
            pooledDataSource.close();
        }
    }

    private NameLookupBackend createBackend() {
        if (jdbcUrl.isEmpty() || jdbcUrl.get().isBlank()) {
            log.warn("name-resolution.backend.jdbc-url not set, name lookups will be unavailable");
            return new UnavailableNameLookupBackend();
        }
        PoolConfig poolConfig = PoolConfig.builder()
                .maxPoolSize(poolMaxSize)
                .minIdle(poolMinIdle)
                .maxLifetime(Duration.ofSeconds(poolMaxLifetimeSeconds))
                .connectionTimeout(Duration.ofMillis(poolConnectionTimeoutMillis))
                .build();
        pooledDataSource = PooledDataSources.create(
                jdbcUrl.get(), username.orElse(null), password.orElse(null), poolConfig);
        log.info("Name lookup backend configured: timeout={}s", queryTimeoutSeconds);
        return new JdbcNameLookupBackend(pooledDataSource, new BackendConfig(queryTimeoutSeconds));
    }
}
