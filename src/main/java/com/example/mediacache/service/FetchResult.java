package com.example.mediacache.service;

import com.example.mediacache.backend.MediaMetadata;
import com.example.mediacache.session.RateLimitStatus;

public record FetchResult(
    MediaMetadata metadata,
    boolean cached,
    boolean showDelay,
    RateLimitStatus rateLimit,
    String sessionId
) {
}
