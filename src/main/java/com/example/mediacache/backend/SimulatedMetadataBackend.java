package com.example.mediacache.backend;

import com.example.mediacache.core.KeyNormalizer;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stand-in for the real extraction pipeline: waits for a configurable latency, counts
 * requests and returns synthetic metadata derived from the locator.
 */
public class SimulatedMetadataBackend implements MetadataBackend {

    private static final List<String> FORMATS = List.of("360p", "720p", "1080p", "audio-m4a");

    private final AtomicLong requestCount = new AtomicLong();
    private final Clock clock;
    private final Duration latency;

    public SimulatedMetadataBackend(Duration latency, Clock clock) {
        this.latency = latency;
        this.clock = clock;
    }

    @Override
    public MediaMetadata fetchMetadata(String locator) {
        requestCount.incrementAndGet();
        try {
            if (!latency.isZero()) {
                Thread.sleep(latency.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataRetrievalException("Interrupted while fetching " + locator, e);
        }
        String key = KeyNormalizer.normalize(locator);
        return new MediaMetadata(key, locator, "Media " + key, 60L + Math.abs(key.hashCode() % 3600),
            FORMATS, clock.instant());
    }

    @Override
    public long getRequestCount() {
        return requestCount.get();
    }

    @Override
    public void resetCount() {
        requestCount.set(0);
    }
}
