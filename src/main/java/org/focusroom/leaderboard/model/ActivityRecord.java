package org.focusroom.leaderboard.model;

import java.time.Instant;

/**
 * One entry of the room's activity feed as persisted in the activity log.
 */
public class ActivityRecord {
    public final Instant estimatedTime;
    public final Instant scrapeTime;
    public final String user;
    public final String action;
    public final String rawTimeAgo;  // e.g. "5 min ago", "2 hours ago"

    public ActivityRecord(Instant estimatedTime, Instant scrapeTime, String user, String action, String rawTimeAgo) {
        this.estimatedTime = estimatedTime;
        this.scrapeTime = scrapeTime;
        this.user = user;
        this.action = action == null ? "" : action;
        this.rawTimeAgo = rawTimeAgo == null ? "" : rawTimeAgo;
    }

    @Override
    public String toString() {
        return "ActivityRecord{estimatedTime=" + estimatedTime + ", user='" + user + "', action='" + action +
               "', timeAgo='" + rawTimeAgo + "'}";
    }
}
