package com.example.mediacache.service;

import com.example.mediacache.session.RateLimitStatus;

/**
 * Outcome of a download request. A rate-limited client gets {@code allowed = false};
 * that is a regular result, not an error.
 */
public record DownloadDecision(
    boolean allowed,
    boolean showDelay,
    RateLimitStatus rateLimit,
    String sessionId
) {
}
