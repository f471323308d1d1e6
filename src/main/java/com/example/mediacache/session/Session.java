package com.example.mediacache.session;

import java.time.Instant;

/**
 * Immutable snapshot of a client's session as held by {@link SessionStore}.
 *
 * @param bypassUntil end of the ad-earned bypass window, or {@code null} when none is set
 */
public record Session(
    String id,
    Instant createdAt,
    Instant lastSeen,
    long downloadCount,
    int dailyDownloads,
    Instant lastReset,
    boolean premium,
    int adViews,
    Instant bypassUntil
) {
}
