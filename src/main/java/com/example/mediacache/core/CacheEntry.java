package com.example.mediacache.core;

import java.time.Instant;

public class CacheEntry<V> {
    public final String key;
    public final V value;
    public final Instant createdAt;
    public final Instant expiresAt;      // entry is served only while now < expiresAt
    public final String sourceLocator;   // the locator the entry was stored under, for diagnostics

    public CacheEntry(String key, V value, Instant createdAt, Instant expiresAt, String sourceLocator) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.sourceLocator = sourceLocator;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
