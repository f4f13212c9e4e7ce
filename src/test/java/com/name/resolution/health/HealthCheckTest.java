package com.name.resolution.health;

import com.name.resolution.backend.NameLookupBackend;
import com.name.resolution.backend.UnavailableNameLookupBackend;
import com.name.resolution.cache.CacheConfig;
import com.name.resolution.cache.TtlNameCache;
import com.name.resolution.core.model.NameRecord;
import com.name.resolution.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Severity should order UP < DEGRADED < DOWN")
        void severityOrder() {
            assertTrue(HealthStatus.down("x").isWorseThan(HealthStatus.degraded("y")));
            assertTrue(HealthStatus.degraded("y").isWorseThan(HealthStatus.up()));
            assertFalse(HealthStatus.up().isWorseThan(HealthStatus.up()));
            assertTrue(HealthStatus.up().isUp());
        }

        @Test
        @DisplayName("withDetail should return a copy with the detail added")
        void withDetail() {
            HealthStatus base = HealthStatus.up();
            HealthStatus detailed = base.withDetail("latencyMs", 4L);

            assertTrue(base.details().isEmpty());
            assertEquals(4L, detailed.details().get("latencyMs"));
            assertThrows(UnsupportedOperationException.class, () -> detailed.details().put("x", 1));
        }
    }

    @Nested
    @DisplayName("BackendHealthCheck")
    class BackendTests {

        @Test
        @DisplayName("Unconfigured backend should be DOWN")
        void unconfiguredIsDown() {
            HealthStatus status = new BackendHealthCheck(new UnavailableNameLookupBackend()).check();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertEquals("UnavailableNameLookupBackend", status.details().get("backend"));
        }

        @Test
        @DisplayName("Reachable backend should be UP")
        void reachableIsUp() {
            NameLookupBackend backend = mock(NameLookupBackend.class);
            when(backend.isAvailable()).thenReturn(true);
            when(backend.ping()).thenReturn(true);

            HealthStatus status = new BackendHealthCheck(backend).check();

            assertTrue(status.isUp());
            assertTrue(status.details().containsKey("latencyMs"));
        }

        @Test
        @DisplayName("Configured backend failing its ping should be DOWN")
        void failedPingIsDown() {
            NameLookupBackend backend = mock(NameLookupBackend.class);
            when(backend.isAvailable()).thenReturn(true);
            when(backend.ping()).thenReturn(false);

            assertEquals(HealthStatus.Status.DOWN, new BackendHealthCheck(backend).check().status());
        }
    }

    @Nested
    @DisplayName("NameCacheHealthCheck")
    class CacheTests {

        private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        private final TtlNameCache cache = new TtlNameCache(CacheConfig.defaults(), clock);

        @Test
        @DisplayName("Empty cache should be UP with stats details")
        void emptyIsUp() {
            HealthStatus status = new NameCacheHealthCheck(cache).check();

            assertTrue(status.isUp());
            assertEquals(0, status.details().get("total"));
            assertEquals("PT1H", status.details().get("not_found_ttl"));
        }

        @Test
        @DisplayName("Mostly expired cache should be DEGRADED")
        void mostlyExpiredIsDegraded() {
            cache.put("1", NameRecord.unresolved("1"), true);
            cache.put("2", NameRecord.unresolved("2"), true);
            clock.advance(Duration.ofHours(2));
            cache.put("3", NameRecord.unresolved("3"), false);

            HealthStatus status = new NameCacheHealthCheck(cache).check();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals(2, status.details().get("expired"));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Empty registry should be UP")
        void emptyIsUp() {
            HealthStatus status = new HealthCheckRegistry().checkAll();

            assertTrue(status.isUp());
            assertEquals("OK", status.message());
        }

        @Test
        @DisplayName("Aggregate should take the worst status and name its check")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("ok", HealthStatus.up()));
            registry.register(fixed("slow", HealthStatus.degraded("lagging")));
            registry.register(null);

            HealthStatus status = registry.checkAll();

            assertEquals(2, registry.size());
            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals("slow: lagging", status.message());
            assertEquals("UP", ((Map<?, ?>) status.details().get("ok")).get("status"));
        }

        @Test
        @DisplayName("A throwing check should count as DOWN")
        void throwingCheckIsDown() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("check failed");
                }
            });

            HealthStatus status = registry.checkAll();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertEquals("broken: IllegalStateException: check failed", status.message());
        }

        private HealthCheck fixed(String name, HealthStatus result) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return result;
                }
            };
        }
    }
}
