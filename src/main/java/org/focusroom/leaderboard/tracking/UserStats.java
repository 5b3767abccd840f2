package org.focusroom.leaderboard.tracking;

import java.time.Instant;

/**
 * Engagement totals for one user over the whole log. Minutes are unrounded.
 */
public class UserStats {
    public final String user;
    public final double totalPresenceMinutes;
    public final double totalWorkMinutes;
    public final double totalBreakMinutes;
    public final int pomodoroCount;
    public final int breakCount;
    public final Instant firstSeen;
    public final Instant lastSeen;
    public final boolean currentlyPresent;  // from the latest snapshot, not window state

    public UserStats(String user, double totalPresenceMinutes, double totalWorkMinutes, double totalBreakMinutes,
                     int pomodoroCount, int breakCount, Instant firstSeen, Instant lastSeen,
                     boolean currentlyPresent) {
        this.user = user;
        this.totalPresenceMinutes = totalPresenceMinutes;
        this.totalWorkMinutes = totalWorkMinutes;
        this.totalBreakMinutes = totalBreakMinutes;
        this.pomodoroCount = pomodoroCount;
        this.breakCount = breakCount;
        this.firstSeen = firstSeen;
        this.lastSeen = lastSeen;
        this.currentlyPresent = currentlyPresent;
    }

    public double avgPomodoroMinutes() {
        return pomodoroCount > 0 ? totalWorkMinutes / pomodoroCount : 0.0;
    }

    public double avgBreakMinutes() {
        return breakCount > 0 ? totalBreakMinutes / breakCount : 0.0;
    }

    @Override
    public String toString() {
        return String.format("UserStats{user='%s', presence=%.1fm, work=%.1fm (%d), break=%.1fm (%d), present=%b}",
            user, totalPresenceMinutes, totalWorkMinutes, pomodoroCount, totalBreakMinutes, breakCount,
            currentlyPresent);
    }
}
