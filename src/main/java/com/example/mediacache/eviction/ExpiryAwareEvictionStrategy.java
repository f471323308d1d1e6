package com.example.mediacache.eviction;

import com.example.mediacache.core.CacheEntry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Evicts the entry closest to expiry. Among entries expiring at the same instant the
 * least recently used one goes first, since the scan walks recency order and only
 * replaces the candidate on a strictly earlier expiry.
 */
public class ExpiryAwareEvictionStrategy implements EvictionStrategy {

    @Override
    public Optional<String> selectVictim(LinkedHashMap<String, ? extends CacheEntry<?>> entries, Instant now) {
        String victim = null;
        Instant soonest = null;
        for (Map.Entry<String, ? extends CacheEntry<?>> e : entries.entrySet()) {
            Instant expiresAt = e.getValue().expiresAt;
            if (soonest == null || expiresAt.isBefore(soonest)) {
                soonest = expiresAt;
                victim = e.getKey();
            }
        }
        return Optional.ofNullable(victim);
    }
}
