package com.example.mediacache.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-client usage tracking: daily download quota, premium override and the ad-earned
 * bypass of the delay gate.
 *
 * <p>All state lives behind one {@link ReentrantLock}; every public method holds it end to
 * end and only does in-memory work. Callers receive {@link Session} snapshots, never the
 * mutable records.
 *
 * <p>Unknown ids are not errors. Each query documents the default it returns instead:
 * {@link #shouldShowDelay(String)} falls back to {@code true} while
 * {@link #rateLimitStatus(String)} reports an unrestricted quota.
 *
 * <p>Delay gating per session moves between Normal and Bypassed. Reaching the ad-view
 * threshold enters Bypassed; the way back to Normal is evaluated lazily in
 * {@link #shouldShowDelay(String)} once the window has passed. Premium overrides both.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, MutableSession> sessions = new HashMap<>();
    private final SessionPolicy policy;
    private final Clock clock;

    public SessionStore(SessionPolicy policy, Clock clock) {
        if (policy.dailyQuota() < 0) {
            throw new IllegalArgumentException("dailyQuota must be >= 0, was " + policy.dailyQuota());
        }
        if (policy.bypassThreshold() <= 0) {
            throw new IllegalArgumentException("bypassThreshold must be > 0, was " + policy.bypassThreshold());
        }
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Returns the session for the given client, creating it on first contact. An existing
     * session has its {@code lastSeen} refreshed and its daily counter rolled over when more
     * than one quota window has passed since the last reset.
     */
    public Session getOrCreateSession(String clientAddress, String userAgent) {
        String id = ClientIdentityResolver.identify(clientAddress, userAgent);
        lock.lock();
        try {
            Instant now = clock.instant();
            MutableSession session = sessions.get(id);
            if (session == null) {
                session = new MutableSession(id, now);
                sessions.put(id, session);
                log.debug("Created session id={}", id);
            } else {
                session.lastSeen = now;
                if (now.isAfter(session.lastReset.plus(policy.quotaWindow()))) {
                    session.dailyDownloads = 0;
                    session.lastReset = now;
                    log.info("Daily download counter reset id={}", id);
                }
            }
            return session.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Session> findSession(String id) {
        lock.lock();
        try {
            MutableSession session = sessions.get(id);
            return session == null ? Optional.empty() : Optional.of(session.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public void incrementDownload(String id) {
        lock.lock();
        try {
            MutableSession session = sessions.get(id);
            if (session != null) {
                session.downloadCount++;
                session.dailyDownloads++;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts an ad view. Every call at or past the threshold restarts the bypass window
     * from now, so continued ad views keep extending it.
     */
    public void incrementAdView(String id) {
        lock.lock();
        try {
            MutableSession session = sessions.get(id);
            if (session == null) {
                return;
            }
            session.adViews++;
            if (session.adViews >= policy.bypassThreshold()) {
                session.bypassUntil = clock.instant().plus(policy.bypassWindow());
                log.debug("Delay bypass granted id={} adViews={} until={}", id, session.adViews, session.bypassUntil);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean shouldShowDelay(String id) {
        lock.lock();
        try {
            MutableSession session = sessions.get(id);
            if (session == null) {
                return true;
            }
            if (session.premium) {
                return false;
            }
            if (session.bypassUntil != null) {
                if (clock.instant().isBefore(session.bypassUntil)) {
                    return false;
                }
                session.bypassUntil = null;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public RateLimitStatus rateLimitStatus(String id) {
        lock.lock();
        try {
            MutableSession session = sessions.get(id);
            if (session == null) {
                return RateLimitStatus.unrestricted(policy.dailyQuota());
            }
            if (session.premium) {
                return RateLimitStatus.unrestricted(RateLimitStatus.PREMIUM_REMAINING);
            }
            int remaining = Math.max(0, policy.dailyQuota() - session.dailyDownloads);
            return new RateLimitStatus(remaining <= 0, remaining, session.lastReset.plus(policy.quotaWindow()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code false} when the id is unknown
     */
    public boolean setPremium(String id, boolean premium) {
        lock.lock();
        try {
            MutableSession session = sessions.get(id);
            if (session == null) {
                return false;
            }
            session.premium = premium;
            log.info("Premium flag updated id={} premium={}", id, premium);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops sessions not seen within the stale-after period.
     *
     * @return number of sessions removed
     */
    public int cleanupOldSessions() {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(policy.staleAfter());
            int removed = 0;
            Iterator<MutableSession> it = sessions.values().iterator();
            while (it.hasNext()) {
                if (it.next().lastSeen.isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Cleaned up old sessions count={}", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    private static final class MutableSession {
        final String id;
        final Instant createdAt;
        Instant lastSeen;
        long downloadCount;
        int dailyDownloads;
        Instant lastReset;
        boolean premium;
        int adViews;
        Instant bypassUntil;

        MutableSession(String id, Instant now) {
            this.id = id;
            this.createdAt = now;
            this.lastSeen = now;
            this.lastReset = now;
        }

        Session snapshot() {
            return new Session(id, createdAt, lastSeen, downloadCount, dailyDownloads,
                lastReset, premium, adViews, bypassUntil);
        }
    }
}
