package org.focusroom.leaderboard.report;

/**
 * Human-readable minute counts: "45m", "2h 5m".
 */
public final class DurationFormat {

    private DurationFormat() {}

    public static String format(double minutes) {
        long total = Math.max(0, Math.round(minutes));
        long hours = total / 60;
        long mins = total % 60;
        if (hours > 0) {
            return hours + "h " + mins + "m";
        }
        return mins + "m";
    }
}
