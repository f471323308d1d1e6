package com.example.mediacache.eviction;

public enum EvictionPolicy {
    LRU,
    EXPIRY_AWARE;

    public EvictionStrategy newStrategy() {
        switch (this) {
            case LRU:
                return new LruEvictionStrategy();
            case EXPIRY_AWARE:
                return new ExpiryAwareEvictionStrategy();
            default:
                throw new IllegalArgumentException("Unknown eviction policy: " + this);
        }
    }
}
