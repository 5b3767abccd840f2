package org.focusroom.leaderboard.ingest;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the feed's relative "time ago" phrases into absolute estimates.
 */
public final class TimeAgo {

    private static final Pattern AGO = Pattern.compile("(\\d+)\\s*(sec|min|hour|day)", Pattern.CASE_INSENSITIVE);

    private TimeAgo() {}

    /**
     * Parse "5 min ago", "2 hours ago", "30 sec ago", "1 day ago".
     * Anything else ("just now", blank) counts as zero.
     */
    public static Duration parse(String timeAgo) {
        if (timeAgo == null || timeAgo.isBlank()) return Duration.ZERO;

        Matcher m = AGO.matcher(timeAgo);
        if (!m.find()) return Duration.ZERO;

        try {
            long value = Long.parseLong(m.group(1));
            switch (m.group(2).toLowerCase()) {
                case "sec":
                    return Duration.ofSeconds(value);
                case "min":
                    return Duration.ofMinutes(value);
                case "hour":
                    return Duration.ofHours(value);
                case "day":
                    return Duration.ofDays(value);
                default:
                    return Duration.ZERO;
            }
        } catch (NumberFormatException | ArithmeticException e) {
            // more digits than a duration holds
            return Duration.ZERO;
        }
    }

    /**
     * Best-guess absolute time of an entry, truncated to the minute.
     * An age reaching past the earliest representable instant counts as zero.
     */
    public static Instant estimate(Instant scrapeTime, String timeAgo) {
        Instant estimated;
        try {
            estimated = scrapeTime.minus(parse(timeAgo));
        } catch (DateTimeException | ArithmeticException e) {
            estimated = scrapeTime;
        }
        return estimated.truncatedTo(ChronoUnit.MINUTES);
    }
}
