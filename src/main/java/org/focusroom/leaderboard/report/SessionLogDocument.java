package org.focusroom.leaderboard.report;

import org.focusroom.leaderboard.model.PresenceWindow;
import org.focusroom.leaderboard.model.TimerEvent;
import org.focusroom.leaderboard.tracking.EngagementResult;
import org.focusroom.leaderboard.tracking.UserStats;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Debug view of a run: every derived timer, every window and the unrounded stats.
 * Written for inspection only; nothing reads it back.
 */
public class SessionLogDocument {

    public static class TimerView {
        public final Instant startTime;
        public final Instant endTime;
        public final String type;
        public final int durationMinutes;
        public final String startedBy;

        TimerView(TimerEvent event) {
            this.startTime = event.startTime;
            this.endTime = event.endTime;
            this.type = event.type.label();
            this.durationMinutes = event.durationMinutes;
            this.startedBy = event.startedBy;
        }
    }

    public static class WindowView {
        public final Instant joinTime;
        public final Instant leaveTime;
        public final boolean stillPresent;

        WindowView(PresenceWindow window) {
            this.joinTime = window.joinTime;
            this.leaveTime = window.leaveTime;
            this.stillPresent = window.stillPresent;
        }
    }

    public static class StatsView {
        public final double totalPresenceMinutes;
        public final double totalWorkMinutes;
        public final double totalBreakMinutes;
        public final int pomodoroCount;
        public final int breakCount;
        public final Instant firstSeen;
        public final Instant lastSeen;
        public final boolean currentlyPresent;

        StatsView(UserStats stats) {
            this.totalPresenceMinutes = stats.totalPresenceMinutes;
            this.totalWorkMinutes = stats.totalWorkMinutes;
            this.totalBreakMinutes = stats.totalBreakMinutes;
            this.pomodoroCount = stats.pomodoroCount;
            this.breakCount = stats.breakCount;
            this.firstSeen = stats.firstSeen;
            this.lastSeen = stats.lastSeen;
            this.currentlyPresent = stats.currentlyPresent;
        }
    }

    public final Instant lastUpdated;
    public final int timerEventCount;
    public final List<TimerView> timerEvents;
    public final Map<String, List<WindowView>> windows;
    public final Map<String, StatsView> userStats;

    private SessionLogDocument(Instant lastUpdated, List<TimerView> timerEvents,
                               Map<String, List<WindowView>> windows, Map<String, StatsView> userStats) {
        this.lastUpdated = lastUpdated;
        this.timerEventCount = timerEvents.size();
        this.timerEvents = timerEvents;
        this.windows = windows;
        this.userStats = userStats;
    }

    public static SessionLogDocument from(EngagementResult result, Instant lastUpdated) {
        List<TimerView> timers = result.timerEvents.stream()
            .map(TimerView::new)
            .collect(Collectors.toList());

        Map<String, List<WindowView>> windows = new LinkedHashMap<>();
        result.windows.forEach((user, list) -> windows.put(user,
            list.stream().map(WindowView::new).collect(Collectors.toList())));

        Map<String, StatsView> stats = new LinkedHashMap<>();
        result.rankedStats.forEach(s -> stats.put(s.user, new StatsView(s)));

        return new SessionLogDocument(lastUpdated, timers, windows, stats);
    }
}
