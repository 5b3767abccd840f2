package org.focusroom.leaderboard.ingest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Builds the bucketed identity of an activity feed entry.
 *
 * The feed reports an entry's age as "N min ago" or "N hours ago", so the further back an
 * entry is, the less precise its estimated time becomes. Keys round the estimated time to
 * the precision of its source phrase: the start of the hour for "hour"/"day" phrasing,
 * the enclosing 30-minute slot otherwise. The scrape time never takes part in the key.
 */
public final class DedupKey {

    private static final long HALF_HOUR_SECONDS = 30 * 60;

    private DedupKey() {}

    public static String of(Instant estimatedTime, String user, String action, String rawTimeAgo) {
        Instant rounded = roundForDedup(estimatedTime, rawTimeAgo);
        return rounded + "|" + LogFields.cleanUser(user) + "|" + LogFields.cleanAction(action);
    }

    /**
     * Round down to the hour for coarse phrasing, to the half hour otherwise (UTC).
     */
    public static Instant roundForDedup(Instant estimatedTime, String rawTimeAgo) {
        if (isCoarse(rawTimeAgo)) {
            return estimatedTime.truncatedTo(ChronoUnit.HOURS);
        }
        long seconds = estimatedTime.getEpochSecond();
        return Instant.ofEpochSecond(seconds - Math.floorMod(seconds, HALF_HOUR_SECONDS));
    }

    static boolean isCoarse(String rawTimeAgo) {
        if (rawTimeAgo == null) return false;
        String lower = rawTimeAgo.toLowerCase();
        return lower.contains("hour") || lower.contains("day");
    }
}
