package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.PresenceWindow;
import org.focusroom.leaderboard.model.TimerEvent;
import org.focusroom.leaderboard.model.TimerSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Output of one engine run.
 */
public class EngagementResult {
    public final Instant computedAt;
    public final List<TimerEvent> timerEvents;
    public final Map<String, List<PresenceWindow>> windows;
    public final List<UserStats> rankedStats;
    public final List<String> currentlyPresent;
    public final TimerSnapshot latestTimer;  // null when no timer snapshot was logged

    public EngagementResult(Instant computedAt, List<TimerEvent> timerEvents,
                            Map<String, List<PresenceWindow>> windows, List<UserStats> rankedStats,
                            List<String> currentlyPresent, TimerSnapshot latestTimer) {
        this.computedAt = computedAt;
        this.timerEvents = List.copyOf(timerEvents);
        this.windows = windows;
        this.rankedStats = List.copyOf(rankedStats);
        this.currentlyPresent = List.copyOf(currentlyPresent);
        this.latestTimer = latestTimer;
    }

    public boolean isEmpty() {
        return rankedStats.isEmpty();
    }
}
