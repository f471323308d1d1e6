package com.example.mediacache.backend;

/**
 * Upstream metadata retrieval. Implementations do blocking I/O and own their timeouts;
 * callers never invoke this while holding a cache or session lock.
 */
public interface MetadataBackend {

    MediaMetadata fetchMetadata(String locator) throws MetadataRetrievalException;

    long getRequestCount();

    void resetCount();
}
