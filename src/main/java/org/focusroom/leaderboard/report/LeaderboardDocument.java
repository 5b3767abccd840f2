package org.focusroom.leaderboard.report;

import org.focusroom.leaderboard.model.TimerSnapshot;
import org.focusroom.leaderboard.tracking.EngagementResult;
import org.focusroom.leaderboard.tracking.UserStats;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The published leaderboard. Minutes are rounded to whole numbers.
 */
public class LeaderboardDocument {

    public static class Entry {
        public final String user;
        public final boolean currentlyPresent;
        public final long totalPresenceMinutes;
        public final long totalWorkMinutes;
        public final long totalBreakMinutes;
        public final int pomodoroCount;
        public final int breakCount;
        public final long avgPomodoroMinutes;
        public final long avgBreakMinutes;
        public final Instant firstSeen;
        public final Instant lastSeen;

        Entry(UserStats stats) {
            this.user = stats.user;
            this.currentlyPresent = stats.currentlyPresent;
            this.totalPresenceMinutes = Math.round(stats.totalPresenceMinutes);
            this.totalWorkMinutes = Math.round(stats.totalWorkMinutes);
            this.totalBreakMinutes = Math.round(stats.totalBreakMinutes);
            this.pomodoroCount = stats.pomodoroCount;
            this.breakCount = stats.breakCount;
            this.avgPomodoroMinutes = Math.round(stats.avgPomodoroMinutes());
            this.avgBreakMinutes = Math.round(stats.avgBreakMinutes());
            this.firstSeen = stats.firstSeen;
            this.lastSeen = stats.lastSeen;
        }
    }

    public static class TimerInfo {
        public final Instant observedAt;
        public final boolean running;
        public final String value;
        public final String sessionType;

        TimerInfo(TimerSnapshot snapshot) {
            this.observedAt = snapshot.timestamp;
            this.running = snapshot.running;
            this.value = snapshot.value;
            this.sessionType = snapshot.sessionType;
        }
    }

    public final Instant generated;
    public final List<String> currentlyPresent;
    public final int totalUsers;
    public final long totalPomodoros;
    public final long totalWorkMinutes;
    public final TimerInfo timer;
    public final List<Entry> users;

    private LeaderboardDocument(Instant generated, List<String> currentlyPresent, TimerInfo timer, List<Entry> users) {
        this.generated = generated;
        this.currentlyPresent = currentlyPresent;
        this.timer = timer;
        this.users = users;
        this.totalUsers = users.size();
        this.totalPomodoros = users.stream().mapToLong(e -> e.pomodoroCount).sum();
        this.totalWorkMinutes = users.stream().mapToLong(e -> e.totalWorkMinutes).sum();
    }

    public static LeaderboardDocument from(EngagementResult result, Instant generated) {
        List<Entry> entries = result.rankedStats.stream()
            .map(Entry::new)
            .collect(Collectors.toList());
        TimerInfo timer = result.latestTimer != null ? new TimerInfo(result.latestTimer) : null;
        return new LeaderboardDocument(generated, result.currentlyPresent, timer, entries);
    }
}
