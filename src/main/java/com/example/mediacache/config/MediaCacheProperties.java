package com.example.mediacache.config;

import com.example.mediacache.eviction.EvictionPolicy;
import com.example.mediacache.refresh.LoadMode;
import com.example.mediacache.session.SessionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "media-cache")
public record MediaCacheProperties(
    @DefaultValue Cache cache,
    @DefaultValue Session session,
    @DefaultValue Fetch fetch,
    @DefaultValue Backend backend
) {

    public record Cache(
        @DefaultValue("100") int maxSize,
        @DefaultValue("300s") Duration defaultTtl,
        @DefaultValue("LRU") EvictionPolicy eviction
    ) {
    }

    public record Session(
        @DefaultValue("10") int dailyQuota,
        @DefaultValue("24h") Duration quotaWindow,
        @DefaultValue("24h") Duration staleAfter,
        @DefaultValue("3") int bypassThreshold,
        @DefaultValue("30m") Duration bypassWindow
    ) {

        public SessionPolicy toPolicy() {
            return new SessionPolicy(dailyQuota, quotaWindow, staleAfter, bypassThreshold, bypassWindow);
        }
    }

    public record Fetch(
        @DefaultValue("COALESCING") LoadMode loadStrategy,
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("3s") Duration retryBackoff
    ) {
    }

    public record Backend(@DefaultValue("500ms") Duration latency) {
    }
}
