package com.example.mediacache.core;

import com.example.mediacache.eviction.EvictionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory cache of upstream metadata with per-entry TTL and LRU ordering.
 *
 * <p>Entries are keyed by {@link KeyNormalizer#normalize(String)}, so equivalent locators
 * share one entry. The store is a {@link LinkedHashMap} in access order (least recently used
 * first). One {@link ReentrantLock} guards the whole store and every public method holds it
 * for its full duration, which makes each call atomic with respect to every other call,
 * including the reaper's {@link #cleanupExpired()} sweep. No method performs I/O.
 *
 * <p>Misses and expiries are reported through return values, never exceptions.
 */
public class CacheService<V> {

    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final ReentrantLock lock = new ReentrantLock();

    // access-order: get/put move the key to the tail
    private final LinkedHashMap<String, CacheEntry<V>> store = new LinkedHashMap<>(16, 0.75f, true);

    private final EvictionStrategy evictionStrategy;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;

    private long hitCount;
    private long missCount;

    public CacheService(EvictionStrategy evictionStrategy, int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0, was " + maxSize);
        }
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive, was " + defaultTtl);
        }
        this.evictionStrategy = evictionStrategy;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public Optional<V> get(String locator) {
        String key = KeyNormalizer.normalize(locator);
        lock.lock();
        try {
            CacheEntry<V> entry = store.get(key);
            if (entry != null) {
                if (!entry.isExpired(clock.instant())) {
                    hitCount++;
                    log.debug("Cache hit key={} hits={} misses={}", key, hitCount, missCount);
                    return Optional.of(entry.value);
                }
                store.remove(key);
                log.debug("Cache entry expired key={}", key);
            }
            missCount++;
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public void set(String locator, V value) {
        set(locator, value, defaultTtl);
    }

    /**
     * Stores {@code value} for {@code ttl}. A null, zero or negative ttl means the default ttl.
     */
    public void set(String locator, V value, Duration ttl) {
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
        String key = KeyNormalizer.normalize(locator);
        lock.lock();
        try {
            Instant now = clock.instant();
            store.put(key, new CacheEntry<>(key, value, now, now.plus(effectiveTtl), locator));

            while (store.size() > maxSize) {
                Optional<String> victim = evictionStrategy.selectVictim(store, now);
                if (victim.isEmpty()) {
                    break;
                }
                store.remove(victim.get());
                log.debug("Evicted cache entry key={}", victim.get());
            }
            log.debug("Cached key={} ttlSeconds={}", key, effectiveTtl.toSeconds());
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(String locator) {
        String key = KeyNormalizer.normalize(locator);
        lock.lock();
        try {
            boolean removed = store.remove(key) != null;
            if (removed) {
                log.info("Invalidated cache entry key={}", key);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            store.clear();
            hitCount = 0;
            missCount = 0;
            log.info("Cache cleared");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry whose expiry has passed. Survivors keep their recency position.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<CacheEntry<V>> it = store.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Cleaned up expired cache entries count={}", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.of(store.size(), maxSize, hitCount, missCount);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }
}
