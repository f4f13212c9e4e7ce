package com.name.resolution.source;

import com.name.resolution.backend.NameLookupBackend;
import com.name.resolution.core.model.NameRecord;
import com.name.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Ordered list of {@link NameSource}s tried until one yields a record.
 *
 * <p>A source that throws is logged and counted, then treated as having no result,
 * so one unreachable table does not stop the others from answering.</p>
 */
public class FallbackChain {
    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    private final List<NameSource> sources;
    private final MetricsService metricsService;

    public FallbackChain(List<NameSource> sources, MetricsService metricsService) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("at least one name source is required");
        }
        this.sources = List.copyOf(sources);
        this.metricsService = metricsService;
    }

    /**
     * The standard chain: cluster, tenant, tenant name only, cluster name only.
     */
    public static FallbackChain standard(NameLookupBackend backend, MetricsService metricsService) {
        return new FallbackChain(List.of(
                new ClusterNameSource(backend),
                new TenantNameSource(backend),
                new TenantNameOnlySource(backend),
                new ClusterNameOnlySource(backend)
        ), metricsService);
    }

    /**
     * Runs the sources in order and returns the first match.
     *
     * @return the match, or empty when every source came up empty or failed
     */
    public Optional<Match> resolve(String id) {
        for (NameSource source : sources) {
            Optional<NameRecord> record;
            try {
                record = source.lookup(id);
            } catch (RuntimeException e) {
                log.warn("name.source.failed id={} source={} error={}", id, source.name(), e.getMessage());
                metricsService.incrementSourceFailure(source.name());
                continue;
            }
            if (record.isPresent()) {
                return Optional.of(new Match(record.get(), source.name()));
            }
        }
        return Optional.empty();
    }

    public List<NameSource> getSources() {
        return sources;
    }

    /**
     * A record together with the name of the source that produced it.
     */
    public record Match(NameRecord record, String source) {}
}
