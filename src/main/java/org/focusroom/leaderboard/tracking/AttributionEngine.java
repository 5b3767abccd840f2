package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.PresenceWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Answers two separate questions about a user and a timer:
 * does the user get the timer counted (eligibility), and how many minutes did they
 * actually spend in the room while it ran (overlap).
 *
 * Eligibility tolerates latecomers: joining within the grace period after the start
 * still counts. Overlap is exact co-presence and ignores eligibility entirely.
 * A window without a leave time is treated as lasting past the timer.
 */
public class AttributionEngine {

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofMinutes(5);

    private final Duration gracePeriod;

    public AttributionEngine(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
    }

    public AttributionEngine() {
        this(DEFAULT_GRACE_PERIOD);
    }

    public boolean eligibleForTimerCount(List<PresenceWindow> windows, Instant timerStart) {
        Instant graceEnd = timerStart.plus(gracePeriod);
        for (PresenceWindow window : windows) {
            boolean containsStart = !window.joinTime.isAfter(timerStart)
                && (window.leaveTime == null || !window.leaveTime.isBefore(timerStart));
            boolean joinedDuringGrace = !window.joinTime.isBefore(timerStart) && !window.joinTime.isAfter(graceEnd);
            if (containsStart || joinedDuringGrace) {
                return true;
            }
        }
        return false;
    }

    public double overlapMinutes(List<PresenceWindow> windows, Instant timerStart, Instant timerEnd) {
        long overlapMillis = 0;
        for (PresenceWindow window : windows) {
            Instant leave = window.leaveTime == null ? timerEnd : window.leaveTime;
            Instant from = window.joinTime.isAfter(timerStart) ? window.joinTime : timerStart;
            Instant to = leave.isBefore(timerEnd) ? leave : timerEnd;
            long millis = Duration.between(from, to).toMillis();
            if (millis > 0) {
                overlapMillis += millis;
            }
        }
        return overlapMillis / 60_000.0;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }
}
