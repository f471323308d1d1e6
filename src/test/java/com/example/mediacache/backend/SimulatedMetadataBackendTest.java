package com.example.mediacache.backend;

import com.example.mediacache.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedMetadataBackendTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final SimulatedMetadataBackend backend = new SimulatedMetadataBackend(Duration.ZERO, clock);

    @Test
    void fetch_returnsMetadataKeyedLikeTheCache() {
        MediaMetadata meta = backend.fetchMetadata("https://youtu.be/abcdefghijk");

        assertEquals("yt_abcdefghijk", meta.key());
        assertEquals("https://youtu.be/abcdefghijk", meta.sourceUrl());
        assertEquals(clock.instant(), meta.fetchedAt());
        assertFalse(meta.formats().isEmpty());
    }

    @Test
    void requestCount_countsFetches_untilReset() {
        backend.fetchMetadata("https://example.org/a");
        backend.fetchMetadata("https://example.org/b");
        assertEquals(2, backend.getRequestCount());

        backend.resetCount();

        assertEquals(0, backend.getRequestCount());
        backend.fetchMetadata("https://example.org/a");
        assertEquals(1, backend.getRequestCount());
    }
}
