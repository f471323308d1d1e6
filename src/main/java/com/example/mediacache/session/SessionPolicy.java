package com.example.mediacache.session;

import java.time.Duration;

/**
 * Limits applied by {@link SessionStore}.
 *
 * @param dailyQuota       downloads allowed per quota window for non-premium sessions
 * @param quotaWindow      length of the rolling window anchored at a session's last reset
 * @param staleAfter       idle time after which the reaper drops a session
 * @param bypassThreshold  ad views that earn a bypass of the delay gate
 * @param bypassWindow     how long an earned bypass lasts
 */
public record SessionPolicy(
    int dailyQuota,
    Duration quotaWindow,
    Duration staleAfter,
    int bypassThreshold,
    Duration bypassWindow
) {

    public static SessionPolicy defaults() {
        return new SessionPolicy(10, Duration.ofHours(24), Duration.ofHours(24), 3, Duration.ofMinutes(30));
    }
}
