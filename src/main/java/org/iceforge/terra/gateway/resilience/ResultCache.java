package org.iceforge.terra.gateway.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded LRU cache with a time-to-live per entry.
 *
 * <p>Backed by an access-ordered {@link LinkedHashMap}; a read moves the entry to the young end
 * and the eldest entry is dropped once capacity is exceeded. Expired entries are removed when
 * they are next read. All operations share one monitor.
 */
public class ResultCache<V> {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CacheEntry<V>> entries;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public ResultCache(int capacity, Duration ttl, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.ttl = Objects.requireNonNull(ttl);
        this.clock = Objects.requireNonNull(clock);
        this.entries = new LinkedHashMap<>(capacity + 1, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry<V>> eldest) {
                if (size() > ResultCache.this.capacity) {
                    evictions++;
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * @return the cached value, or {@code null} if absent or expired
     */
    public synchronized V get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            log.debug("Cache miss: {}", key);
            return null;
        }
        if (isExpired(entry)) {
            entries.remove(key);
            expirations++;
            misses++;
            log.debug("Cache entry expired: {}", key);
            return null;
        }
        hits++;
        log.debug("Cache hit: {}", key);
        return entry.value;
    }

    public synchronized void put(String key, V value) {
        entries.put(key, new CacheEntry<>(Objects.requireNonNull(value), clock.instant()));
    }

    /**
     * @return the number of entries removed
     */
    public synchronized int clear() {
        int n = entries.size();
        entries.clear();
        return n;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Stats stats() {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
        return new Stats(entries.size(), capacity, ttl.toSeconds(), hits, misses, evictions, expirations, hitRate);
    }

    private boolean isExpired(CacheEntry<V> entry) {
        return !clock.instant().isBefore(entry.storedAt.plus(ttl));
    }

    private static final class CacheEntry<V> {
        final V value;
        final Instant storedAt;

        CacheEntry(V value, Instant storedAt) {
            this.value = value;
            this.storedAt = storedAt;
        }
    }

    public record Stats(int size, int capacity, long ttlSeconds, long hits, long misses,
                        long evictions, long expirations, double hitRate) {
    }
}
