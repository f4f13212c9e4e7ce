package com.name.resolution.cache;

import com.name.resolution.core.model.NameRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory {@link NameCache} with separate TTLs for found and not-found entries.
 *
 * <p>All entries live in one map guarded by a single read/write lock. Reads take the
 * read lock; writes, clears and sweeps take the write lock. Entries are immutable and
 * only ever replaced, so readers never see a partial write. Expired entries are not
 * removed on read; call {@link #cleanExpired()} periodically (see {@link CacheHousekeeper}).</p>
 *
 * <p>The lock is never held across backend I/O. The cache has no size bound; growth is
 * limited by the TTLs and the sweep.</p>
 */
public class TtlNameCache implements NameCache {
    private static final Logger log = LoggerFactory.getLogger(TtlNameCache.class);

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CacheConfig config;
    private final Clock clock;

    public TtlNameCache(CacheConfig config) {
        this(config, Clock.systemUTC());
    }

    public TtlNameCache(CacheConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        log.info("TtlNameCache initialized: cacheTtl={}, notFoundTtl={}",
                config.cacheTtl(), config.notFoundTtl());
    }

    @Override
    public Optional<CacheEntry> get(String id) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(id);
            if (entry == null || !isValid(entry, now)) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void put(String id, NameRecord record, boolean notFound) {
        CacheEntry entry = new CacheEntry(record, notFound, clock.instant());
        lock.writeLock().lock();
        try {
            entries.put(id, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Name cache cleared");
    }

    @Override
    public int cleanExpired() {
        Instant now = clock.instant();
        int cleaned = 0;
        lock.writeLock().lock();
        try {
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (!isValid(it.next(), now)) {
                    it.remove();
                    cleaned++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (cleaned > 0) {
            log.info("Cleaned {} expired name cache entries", cleaned);
        }
        return cleaned;
    }

    @Override
    public CacheStats stats() {
        Instant now = clock.instant();
        int found = 0;
        int notFound = 0;
        int expired = 0;
        int total;
        lock.readLock().lock();
        try {
            total = entries.size();
            for (CacheEntry entry : entries.values()) {
                if (!isValid(entry, now)) {
                    expired++;
                } else if (entry.notFound()) {
                    notFound++;
                } else {
                    found++;
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return new CacheStats(total, found, notFound, expired, config.cacheTtl(), config.notFoundTtl());
    }

    // valid iff age < ttl for the entry's class
    private boolean isValid(CacheEntry entry, Instant now) {
        Duration age = Duration.between(entry.storedAt(), now);
        return age.compareTo(config.ttlFor(entry.notFound())) < 0;
    }
}
