package org.focusroom.leaderboard.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One continuous stay of a user in the room.
 * An open window has no leave time yet.
 */
public class PresenceWindow {
    public final String user;
    public final Instant joinTime;
    public final Instant leaveTime;
    public final boolean stillPresent;

    private PresenceWindow(String user, Instant joinTime, Instant leaveTime, boolean stillPresent) {
        this.user = user;
        this.joinTime = joinTime;
        this.leaveTime = leaveTime;
        this.stillPresent = stillPresent;
    }

    public static PresenceWindow open(String user, Instant joinTime) {
        return new PresenceWindow(user, joinTime, null, false);
    }

    public static PresenceWindow closed(String user, Instant joinTime, Instant leaveTime) {
        return new PresenceWindow(user, joinTime, clamp(joinTime, leaveTime), false);
    }

    /**
     * Close this window. The leave time never precedes the join time.
     */
    public PresenceWindow close(Instant leaveTime) {
        return new PresenceWindow(user, joinTime, clamp(joinTime, leaveTime), false);
    }

    /**
     * Close a window that was still open after the last snapshot.
     */
    public PresenceWindow closeStillPresent(Instant now) {
        return new PresenceWindow(user, joinTime, clamp(joinTime, now), true);
    }

    public boolean isOpen() {
        return leaveTime == null;
    }

    public double durationMinutes() {
        if (leaveTime == null) return 0.0;
        return Duration.between(joinTime, leaveTime).toMillis() / 60_000.0;
    }

    private static Instant clamp(Instant joinTime, Instant leaveTime) {
        return leaveTime.isBefore(joinTime) ? joinTime : leaveTime;
    }

    @Override
    public String toString() {
        return "PresenceWindow{user='" + user + "', join=" + joinTime + ", leave=" + leaveTime +
               ", stillPresent=" + stillPresent + "}";
    }
}
