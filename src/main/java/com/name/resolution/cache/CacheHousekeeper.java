package com.name.resolution.cache;

import com.name.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps expired entries out of a {@link NameCache}.
 * Runs on a single daemon thread so it never keeps the process alive.
 */
public class CacheHousekeeper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheHousekeeper.class);

    private final NameCache cache;
    private final Duration interval;
    private final MetricsService metricsService;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public CacheHousekeeper(NameCache cache, Duration interval, MetricsService metricsService) {
        if (interval.isNegative() || interval.toMillis() < 1) {
            throw new IllegalArgumentException("interval must be at least 1ms, got " + interval);
        }
        this.cache = cache;
        this.interval = interval;
        this.metricsService = metricsService;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "name-cache-housekeeper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic sweep. Calling start twice has no further effect.
     */
    public synchronized void start() {
        if (task != null) {
            return;
        }
        long millis = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        log.info("cache.housekeeper.started interval={}", interval);
    }

    /**
     * Runs one sweep now.
     *
     * @return number of entries removed
     */
    public int sweep() {
        try {
            int removed = cache.cleanExpired();
            metricsService.recordExpiredRemoved(removed);
            return removed;
        } catch (RuntimeException e) {
            // an escaping exception would cancel the scheduled task
            log.error("cache.housekeeper.failed error={}", e.getMessage(), e);
            return 0;
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
        }
        scheduler.shutdownNow();
        log.info("cache.housekeeper.stopped");
    }
}
