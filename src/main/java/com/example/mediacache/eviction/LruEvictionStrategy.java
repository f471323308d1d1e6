package com.example.mediacache.eviction;

import com.example.mediacache.core.CacheEntry;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Evicts the least recently used entry, regardless of how long it still has to live.
 */
public class LruEvictionStrategy implements EvictionStrategy {

    @Override
    public Optional<String> selectVictim(LinkedHashMap<String, ? extends CacheEntry<?>> entries, Instant now) {
        Iterator<String> it = entries.keySet().iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }
}
