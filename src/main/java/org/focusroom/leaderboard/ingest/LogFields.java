package org.focusroom.leaderboard.ingest;

/**
 * Field normalisation applied before values are written to, or compared against, the raw logs.
 * Both the log writer and the dedup key builder go through here so that a freshly scraped
 * value and the same value re-read from disk are identical.
 */
public final class LogFields {

    private LogFields() {}

    /**
     * Actions keep their wording; commas become semicolons so the column count survives.
     */
    public static String cleanAction(String action) {
        if (action == null) return "";
        return action.replace(',', ';')
                     .replace('\r', ' ')
                     .replace('\n', ' ')
                     .trim();
    }

    /**
     * User ids appear both as a CSV column and inside the ';'-joined presence list,
     * so neither separator (nor the quote) may survive.
     */
    public static String cleanUser(String user) {
        if (user == null) return "";
        return user.replace(',', ' ')
                   .replace(';', ' ')
                   .replace('"', ' ')
                   .replace('\r', ' ')
                   .replace('\n', ' ')
                   .trim();
    }

    public static String cleanTimeAgo(String timeAgo) {
        if (timeAgo == null) return "";
        return timeAgo.replace(',', ' ').replace('\n', ' ').trim();
    }
}
