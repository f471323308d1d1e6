package com.example.mediacache.config;

import com.example.mediacache.backend.MediaMetadata;
import com.example.mediacache.backend.SimulatedMetadataBackend;
import com.example.mediacache.core.CacheService;
import com.example.mediacache.service.MediaInfoService;
import com.example.mediacache.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the cache, the session store and the request pipeline as explicit beans. Each
 * application context owns its own instances, so nothing is shared through static state.
 */
@Configuration
@EnableConfigurationProperties(MediaCacheProperties.class)
public class CoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheService<MediaMetadata> metadataCache(MediaCacheProperties props, Clock clock) {
        MediaCacheProperties.Cache cfg = props.cache();
        log.info("Metadata cache maxSize={} defaultTtlSeconds={} eviction={}",
                 cfg.maxSize(), cfg.defaultTtl().toSeconds(), cfg.eviction());
        return new CacheService<>(cfg.eviction().newStrategy(), cfg.maxSize(), cfg.defaultTtl(), clock);
    }

    @Bean
    public SessionStore sessionStore(MediaCacheProperties props, Clock clock) {
        return new SessionStore(props.session().toPolicy(), clock);
    }

    @Bean
    public SimulatedMetadataBackend metadataBackend(MediaCacheProperties props, Clock clock) {
        return new SimulatedMetadataBackend(props.backend().latency(), clock);
    }

    @Bean
    public MediaInfoService mediaInfoService(
        CacheService<MediaMetadata> metadataCache,
        SessionStore sessionStore,
        SimulatedMetadataBackend metadataBackend,
        MediaCacheProperties props
    ) {
        MediaCacheProperties.Fetch fetch = props.fetch();
        log.info("Fetch pipeline loadStrategy={} maxAttempts={}", fetch.loadStrategy(), fetch.maxAttempts());
        return new MediaInfoService(metadataCache, sessionStore, metadataBackend,
            fetch.loadStrategy().newStrategy(), fetch.maxAttempts(), fetch.retryBackoff());
    }
}
