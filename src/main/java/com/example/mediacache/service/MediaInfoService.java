package com.example.mediacache.service;

import com.example.mediacache.backend.MediaMetadata;
import com.example.mediacache.backend.MetadataBackend;
import com.example.mediacache.backend.MetadataRetrievalException;
import com.example.mediacache.core.CacheService;
import com.example.mediacache.core.KeyNormalizer;
import com.example.mediacache.refresh.LoadStrategy;
import com.example.mediacache.session.RateLimitStatus;
import com.example.mediacache.session.Session;
import com.example.mediacache.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Request flow in front of the metadata backend: resolve the client's session, read its
 * quota and delay-gate state, then serve metadata from the cache or load it upstream and
 * write it back.
 *
 * <p>Session and cache reads are separate snapshots; nothing here spans both stores
 * atomically. Upstream loads run outside both store locks.
 */
public class MediaInfoService {

    private static final Logger log = LoggerFactory.getLogger(MediaInfoService.class);

    private final CacheService<MediaMetadata> cache;
    private final SessionStore sessions;
    private final MetadataBackend backend;
    private final LoadStrategy<MediaMetadata> loadStrategy;
    private final int maxAttempts;
    private final Duration retryBackoff;

    public MediaInfoService(
        CacheService<MediaMetadata> cache,
        SessionStore sessions,
        MetadataBackend backend,
        LoadStrategy<MediaMetadata> loadStrategy,
        int maxAttempts,
        Duration retryBackoff
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        this.cache = cache;
        this.sessions = sessions;
        this.backend = backend;
        this.loadStrategy = loadStrategy;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
    }

    public FetchResult fetch(String locator, String clientAddress, String userAgent) {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        Session session = sessions.getOrCreateSession(clientAddress, userAgent);
        RateLimitStatus rateLimit = sessions.rateLimitStatus(session.id());
        boolean showDelay = sessions.shouldShowDelay(session.id());

        Optional<MediaMetadata> cached = cache.get(locator);
        if (cached.isPresent()) {
            return new FetchResult(cached.get(), true, showDelay, rateLimit, session.id());
        }

        MediaMetadata loaded = loadStrategy.load(KeyNormalizer.normalize(locator), () -> {
            MediaMetadata metadata = fetchWithRetries(locator);
            cache.set(locator, metadata);
            return metadata;
        });
        return new FetchResult(loaded, false, showDelay, rateLimit, session.id());
    }

    public DownloadDecision recordDownload(String locator, String clientAddress, String userAgent) {
        Session session = sessions.getOrCreateSession(clientAddress, userAgent);
        RateLimitStatus before = sessions.rateLimitStatus(session.id());
        boolean showDelay = sessions.shouldShowDelay(session.id());
        if (before.limited()) {
            log.info("Download refused, daily quota used id={} resetTime={}", session.id(), before.resetTime());
            return new DownloadDecision(false, showDelay, before, session.id());
        }
        sessions.incrementDownload(session.id());
        log.debug("Download recorded id={} key={}", session.id(), KeyNormalizer.normalize(locator));
        return new DownloadDecision(true, showDelay, sessions.rateLimitStatus(session.id()), session.id());
    }

    public SessionView recordAdView(String clientAddress, String userAgent) {
        Session session = sessions.getOrCreateSession(clientAddress, userAgent);
        sessions.incrementAdView(session.id());
        return describe(session.id());
    }

    public SessionView currentSession(String clientAddress, String userAgent) {
        Session session = sessions.getOrCreateSession(clientAddress, userAgent);
        return describe(session.id());
    }

    private SessionView describe(String id) {
        boolean showDelay = sessions.shouldShowDelay(id);
        RateLimitStatus rateLimit = sessions.rateLimitStatus(id);
        Session session = sessions.findSession(id)
            .orElseThrow(() -> new IllegalStateException("Session vanished while being read: " + id));
        return new SessionView(session, rateLimit, showDelay);
    }

    private MediaMetadata fetchWithRetries(String locator) {
        MetadataRetrievalException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                pause(retryBackoff.multipliedBy(attempt - 1), locator);
            }
            try {
                return backend.fetchMetadata(locator);
            } catch (MetadataRetrievalException e) {
                last = e;
                log.warn("Metadata fetch attempt {}/{} failed url={}: {}", attempt, maxAttempts, locator, e.getMessage());
            }
        }
        log.error("Metadata fetch gave up after {} attempts url={}", maxAttempts, locator);
        throw last;
    }

    private static void pause(Duration delay, String locator) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataRetrievalException("Interrupted between fetch attempts for " + locator, e);
        }
    }
}
