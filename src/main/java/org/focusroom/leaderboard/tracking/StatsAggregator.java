package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.PresenceWindow;
import org.focusroom.leaderboard.model.TimerEvent;
import org.focusroom.leaderboard.model.TimerType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds presence windows and timer attribution into ranked per-user statistics.
 */
public class StatsAggregator {

    private final AttributionEngine attribution;

    public StatsAggregator(AttributionEngine attribution) {
        this.attribution = attribution;
    }

    /**
     * One entry per user with windows, ranked by presence minutes descending.
     * Ties keep the order of {@code windowsByUser}.
     *
     * @param windowsByUser     closed windows per user, in order of first appearance
     * @param timers            timer events of the whole log
     * @param currentlyPresent  members of the latest presence snapshot
     */
    public List<UserStats> aggregate(Map<String, List<PresenceWindow>> windowsByUser, List<TimerEvent> timers,
                                     Set<String> currentlyPresent) {
        List<UserStats> result = new ArrayList<>(windowsByUser.size());

        windowsByUser.forEach((user, windows) -> {
            if (windows.isEmpty()) return;

            double presence = 0.0;
            Instant firstSeen = null;
            Instant lastSeen = null;
            for (PresenceWindow window : windows) {
                presence += window.durationMinutes();
                if (firstSeen == null || window.joinTime.isBefore(firstSeen)) firstSeen = window.joinTime;
                Instant end = window.leaveTime != null ? window.leaveTime : window.joinTime;
                if (lastSeen == null || end.isAfter(lastSeen)) lastSeen = end;
            }

            double workMinutes = 0.0;
            double breakMinutes = 0.0;
            int pomodoros = 0;
            int breaks = 0;
            for (TimerEvent timer : timers) {
                boolean eligible = attribution.eligibleForTimerCount(windows, timer.startTime);
                double overlap = attribution.overlapMinutes(windows, timer.startTime, timer.endTime);
                if (timer.type == TimerType.WORK) {
                    if (eligible) pomodoros++;
                    workMinutes += overlap;
                } else {
                    if (eligible) breaks++;
                    breakMinutes += overlap;
                }
            }

            result.add(new UserStats(user, presence, workMinutes, breakMinutes, pomodoros, breaks,
                firstSeen, lastSeen, currentlyPresent.contains(user)));
        });

        // List.sort is stable, so equal presence keeps first-appearance order
        result.sort(Comparator.comparingDouble((UserStats s) -> s.totalPresenceMinutes).reversed());
        return result;
    }
}
