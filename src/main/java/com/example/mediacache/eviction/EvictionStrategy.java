package com.example.mediacache.eviction;

import com.example.mediacache.core.CacheEntry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Chooses which entry leaves the cache when it grows past capacity.
 *
 * <p>The map handed in is ordered by recency, least recently used first. Implementations
 * only pick a key; the caller removes it and is already holding the cache lock.
 */
public interface EvictionStrategy {
    Optional<String> selectVictim(LinkedHashMap<String, ? extends CacheEntry<?>> entries, Instant now);
}
