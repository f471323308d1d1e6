package com.example.mediacache.backend;

import java.time.Instant;
import java.util.List;

/**
 * Metadata returned by the upstream retrieval pipeline for one media locator.
 */
public record MediaMetadata(
    String key,
    String sourceUrl,
    String title,
    Long durationSeconds,
    List<String> formats,
    Instant fetchedAt
) {
}
