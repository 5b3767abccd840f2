package org.focusroom.leaderboard.tracking;

/**
 * What a single line of the activity feed says, as far as engagement is concerned.
 */
public class ActivityClassification {

    public enum Kind {
        WORK_START,
        BREAK_START,
        STOP,
        JOIN,
        UNRECOGNIZED
    }

    public static final ActivityClassification UNRECOGNIZED = new ActivityClassification(Kind.UNRECOGNIZED, 0);

    public final Kind kind;
    public final int durationMinutes;  // only meaningful for WORK_START / BREAK_START

    public ActivityClassification(Kind kind, int durationMinutes) {
        this.kind = kind;
        this.durationMinutes = durationMinutes;
    }

    public boolean isTimerStart() {
        return kind == Kind.WORK_START || kind == Kind.BREAK_START;
    }

    @Override
    public String toString() {
        return isTimerStart() ? kind + "{" + durationMinutes + "m}" : kind.toString();
    }
}
