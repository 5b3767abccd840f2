package org.focusroom.leaderboard.model;

import java.time.Instant;

/**
 * A detected start of a work or break timer with a fixed duration.
 */
public class TimerEvent {
    public final Instant startTime;
    public final Instant endTime;
    public final TimerType type;
    public final int durationMinutes;
    public final String startedBy;

    public TimerEvent(Instant startTime, TimerType type, int durationMinutes, String startedBy) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Timer duration must be positive: " + durationMinutes);
        }
        this.startTime = startTime;
        this.endTime = startTime.plusSeconds(durationMinutes * 60L);
        this.type = type;
        this.durationMinutes = durationMinutes;
        this.startedBy = startedBy;
    }

    @Override
    public String toString() {
        return String.format("TimerEvent{type=%s, duration=%dm, start=%s, startedBy='%s'}",
            type.label(), durationMinutes, startTime, startedBy);
    }
}
