package com.proxyhub.provider.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory store of materialized provider documents, one {@link CacheEntry} per configuration.
 *
 * <p><strong>Fetch Once → Serve Many:</strong> the sync scheduler writes, client polls read.
 * Reads vastly outnumber writes, so the map is guarded by a read/write lock and every write
 * is a single whole-entry swap.
 *
 * <p>An entry whose {@code fetchedAt} is older than the one already held is refused, so a slow
 * refresh finishing late can never roll the cache back.
 */
@Component
public class ProviderCacheStore {

    private static final Logger log = LoggerFactory.getLogger(ProviderCacheStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, CacheEntry> entries = new HashMap<>();
    private final Clock clock;

    public ProviderCacheStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<CacheEntry> get(long configId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(configId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores {@code entry}, replacing whatever was cached for {@code configId}.
     *
     * @return {@code false} when the entry was refused because a newer one is already cached
     */
    public boolean set(long configId, CacheEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (entry.configId() != configId) {
            throw new IllegalArgumentException(
                "entry for config " + entry.configId() + " stored under key " + configId);
        }

        CacheEntry current;
        lock.writeLock().lock();
        try {
            current = entries.get(configId);
            if (current != null && entry.fetchedAt().isBefore(current.fetchedAt())) {
                log.info("CACHE_SET_REFUSED configId={} fetchedAt={} heldFetchedAt={}",
                         configId, entry.fetchedAt(), current.fetchedAt());
                return false;
            }
            entries.put(configId, entry);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("CACHE_SET configId={} nodeCount={} intervalSeconds={}",
                 configId, entry.nodeCount(), entry.effectiveInterval().toSeconds());
        return true;
    }

    public void delete(long configId) {
        CacheEntry removed;
        lock.writeLock().lock();
        try {
            removed = entries.remove(configId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            log.info("CACHE_DELETE configId={}", configId);
        }
    }

    /**
     * Applies a new refresh cadence to an existing entry without refetching.
     * No-op when nothing is cached for {@code configId}.
     *
     * @return {@code true} if an entry was present and its interval changed
     */
    public boolean updateInterval(long configId, int interval) {
        int previous;
        lock.writeLock().lock();
        try {
            CacheEntry current = entries.get(configId);
            if (current == null || current.interval() == interval) {
                return false;
            }
            previous = current.interval();
            entries.put(configId, current.withInterval(interval));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("CACHE_INTERVAL_UPDATED configId={} from={} to={}", configId, previous, interval);
        return true;
    }

    /**
     * {@code true} when {@code entry} is {@code null} or strictly older than its effective interval.
     */
    public boolean isExpired(CacheEntry entry) {
        if (entry == null) {
            return true;
        }
        Duration age = Duration.between(entry.fetchedAt(), clock.instant());
        return age.compareTo(entry.effectiveInterval()) > 0;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("CACHE_CLEAR");
    }

    public CacheStatus status(long configId) {
        return get(configId)
            .map(entry -> CacheStatus.of(entry, isExpired(entry)))
            .orElseGet(CacheStatus::missing);
    }

    /** Status of every cached entry, ordered by configuration id. */
    public Map<Long, CacheStatus> allStatuses() {
        Map<Long, CacheStatus> result = new TreeMap<>();
        lock.readLock().lock();
        try {
            entries.forEach((id, entry) -> result.put(id, CacheStatus.of(entry, isExpired(entry))));
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    public Set<Long> cachedIds() {
        lock.readLock().lock();
        try {
            return Set.copyOf(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
