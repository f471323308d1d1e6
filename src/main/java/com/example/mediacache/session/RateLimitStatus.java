package com.example.mediacache.session;

import java.time.Instant;

/**
 * Quota position of a session. {@code resetTime} is {@code null} for unknown and premium sessions.
 */
public record RateLimitStatus(boolean limited, int remaining, Instant resetTime) {

    public static final int PREMIUM_REMAINING = 999;

    static RateLimitStatus unrestricted(int remaining) {
        return new RateLimitStatus(false, remaining, null);
    }
}
