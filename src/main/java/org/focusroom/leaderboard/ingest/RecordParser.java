package org.focusroom.leaderboard.ingest;

import org.focusroom.leaderboard.model.ActivityRecord;
import org.focusroom.leaderboard.model.PresenceSnapshot;
import org.focusroom.leaderboard.model.TimerSnapshot;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw log rows into typed records.
 * Rows whose timestamp cannot be parsed are skipped; ingestion never stops on a bad row.
 */
public final class RecordParser {

    private static final Logger LOG = Logger.getLogger(RecordParser.class);

    private RecordParser() {}

    public static List<ActivityRecord> parseActivities(List<Map<String, String>> rows) {
        List<ActivityRecord> records = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Instant estimated = parseInstant(row.get("estimated_time"));
            if (estimated == null) {
                LOG.debugf("Skipping activity row with bad estimated_time: %s", row);
                continue;
            }
            Instant scraped = parseInstant(row.get("scrape_time"));
            records.add(new ActivityRecord(
                estimated,
                scraped != null ? scraped : estimated,
                row.getOrDefault("user", ""),
                row.getOrDefault("action", ""),
                row.getOrDefault("time_ago_raw", "")
            ));
        }
        return records;
    }

    /**
     * Presence snapshots come back in timestamp order (stable for equal timestamps).
     */
    public static List<PresenceSnapshot> parsePresence(List<Map<String, String>> rows) {
        List<PresenceSnapshot> snapshots = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Instant timestamp = parseInstant(row.get("timestamp"));
            if (timestamp == null) {
                LOG.debugf("Skipping presence row with bad timestamp: %s", row);
                continue;
            }
            snapshots.add(new PresenceSnapshot(timestamp, parseUserList(DelimitedLogReader.unquote(row.getOrDefault("users", "")))));
        }
        snapshots.sort(Comparator.comparing(s -> s.timestamp));
        return snapshots;
    }

    public static List<TimerSnapshot> parseTimerSnapshots(List<Map<String, String>> rows) {
        List<TimerSnapshot> snapshots = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Instant timestamp = parseInstant(row.get("timestamp"));
            if (timestamp == null) {
                LOG.debugf("Skipping timer snapshot row with bad timestamp: %s", row);
                continue;
            }
            snapshots.add(new TimerSnapshot(
                timestamp,
                "true".equalsIgnoreCase(row.getOrDefault("timer_running", "")),
                row.get("timer_value"),
                row.get("session_type")
            ));
        }
        snapshots.sort(Comparator.comparing(s -> s.timestamp));
        return snapshots;
    }

    public static Set<String> parseUserList(String users) {
        Set<String> result = new LinkedHashSet<>();
        if (users == null || users.isBlank()) return result;
        Arrays.stream(users.split(";"))
            .map(String::trim)
            .filter(u -> !u.isEmpty())
            .forEach(result::add);
        return result;
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
