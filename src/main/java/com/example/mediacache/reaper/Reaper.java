package com.example.mediacache.reaper;

import com.example.mediacache.backend.MediaMetadata;
import com.example.mediacache.core.CacheService;
import com.example.mediacache.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Recurring sweep that drops expired cache entries and stale sessions.
 *
 * <p>Runs on Spring's task scheduler with a fixed delay, so the schedule ends when the
 * application context shuts down. A failing tick is logged and the next one still runs.
 * Each store is swept under its own lock in turn, never both at once.
 */
@Component
public class Reaper {

    private static final Logger log = LoggerFactory.getLogger(Reaper.class);

    private final CacheService<MediaMetadata> cache;
    private final SessionStore sessions;

    public Reaper(CacheService<MediaMetadata> cache, SessionStore sessions) {
        this.cache = cache;
        this.sessions = sessions;
    }

    @Scheduled(
        fixedDelayString = "${media-cache.reaper.interval:PT10M}",
        initialDelayString = "${media-cache.reaper.interval:PT10M}"
    )
    public void sweep() {
        try {
            int expired = cache.cleanupExpired();
            int stale = sessions.cleanupOldSessions();
            log.info("Periodic cleanup expiredCacheEntries={} staleSessions={}", expired, stale);
        } catch (RuntimeException e) {
            log.error("Periodic cleanup failed, next run stays scheduled", e);
        }
    }
}
