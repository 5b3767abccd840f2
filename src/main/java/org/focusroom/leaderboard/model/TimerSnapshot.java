package org.focusroom.leaderboard.model;

import java.time.Instant;

/**
 * State of the shared room timer as observed by the collector.
 */
public class TimerSnapshot {
    public final Instant timestamp;
    public final boolean running;
    public final String value;        // "mm:ss" as displayed
    public final String sessionType;  // "work", "break" or "unknown"

    public TimerSnapshot(Instant timestamp, boolean running, String value, String sessionType) {
        this.timestamp = timestamp;
        this.running = running;
        this.value = value == null || value.isBlank() ? "00:00" : value;
        this.sessionType = sessionType == null || sessionType.isBlank() ? "unknown" : sessionType;
    }

    @Override
    public String toString() {
        return String.format("TimerSnapshot{timestamp=%s, running=%b, value='%s', sessionType='%s'}",
            timestamp, running, value, sessionType);
    }
}
