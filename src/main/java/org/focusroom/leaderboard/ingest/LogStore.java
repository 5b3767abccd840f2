package org.focusroom.leaderboard.ingest;

import org.focusroom.leaderboard.model.ActivityRecord;
import org.focusroom.leaderboard.model.PresenceSnapshot;
import org.focusroom.leaderboard.model.TimerSnapshot;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The three append-only raw logs plus the derived documents, all under one data directory.
 */
public class LogStore {

    private static final Logger LOG = Logger.getLogger(LogStore.class);

    public static final String ACTIVITIES_FILE = "activities.csv";
    public static final String PRESENCE_FILE = "presence.csv";
    public static final String SNAPSHOTS_FILE = "snapshots.csv";

    static final String ACTIVITIES_HEADER = "estimated_time,scrape_time,user,action,time_ago_raw";
    static final String PRESENCE_HEADER = "timestamp,user_count,users";
    static final String SNAPSHOTS_HEADER = "timestamp,timer_running,timer_value,session_type";

    private static final int ACTIVITY_COLUMNS = 5;

    private final Path dataDir;

    /**
     * One consistent read of the raw logs.
     */
    public static class RawLogs {
        public final List<ActivityRecord> activities;
        public final List<PresenceSnapshot> presence;
        public final List<TimerSnapshot> timerSnapshots;

        public RawLogs(List<ActivityRecord> activities, List<PresenceSnapshot> presence, List<TimerSnapshot> timerSnapshots) {
            this.activities = activities;
            this.presence = presence;
            this.timerSnapshots = timerSnapshots;
        }
    }

    public LogStore(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path path(String fileName) {
        return dataDir.resolve(fileName);
    }

    // Reading

    /**
     * Read all three logs under the same lock that guards appends.
     */
    public synchronized RawLogs readAll() {
        return new RawLogs(readActivities(), readPresence(), readTimerSnapshots());
    }

    public List<ActivityRecord> readActivities() {
        return RecordParser.parseActivities(DelimitedLogReader.read(path(ACTIVITIES_FILE)));
    }

    public List<PresenceSnapshot> readPresence() {
        return RecordParser.parsePresence(DelimitedLogReader.read(path(PRESENCE_FILE)));
    }

    public List<TimerSnapshot> readTimerSnapshots() {
        return RecordParser.parseTimerSnapshots(DelimitedLogReader.read(path(SNAPSHOTS_FILE)));
    }

    /**
     * Re-derive the dedup keys of every persisted activity.
     * Rows with the wrong column count or an unparseable time are skipped.
     */
    public Set<String> loadExistingKeys() {
        Path file = path(ACTIVITIES_FILE);
        Set<String> keys = new HashSet<>();
        if (!Files.exists(file)) {
            return keys;
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LogStoreException("Failed to read " + file, e);
        }

        int skipped = 0;
        for (String line : lines.subList(Math.min(1, lines.size()), lines.size())) {
            if (line.isBlank()) continue;
            String[] parts = line.split(",", -1);
            Instant estimated = parts.length == ACTIVITY_COLUMNS ? RecordParser.parseInstant(parts[0]) : null;
            if (estimated == null) {
                skipped++;
                continue;
            }
            keys.add(DedupKey.of(estimated, parts[2], parts[3], parts[4]));
        }

        if (skipped > 0) {
            LOG.debugf("Skipped %d malformed activity rows while loading dedup keys", skipped);
        }
        return keys;
    }

    // Writing

    /**
     * Append one collector visit to the logs. Activities already present in the log
     * (by dedup key) or repeated within the batch are dropped, as are system actors.
     */
    public synchronized ScrapeReceipt appendScrape(ScrapeBatch batch, Instant defaultScrapeTime, Set<String> systemActors) {
        Instant scrapeTime = batch.scrapeTime != null ? batch.scrapeTime : defaultScrapeTime;

        // All rows are built before any file is touched
        String timerLine = null;
        if (batch.timer != null) {
            timerLine = String.format("%s,%b,%s,%s",
                scrapeTime,
                batch.timer.running,
                LogFields.cleanTimeAgo(Objects.requireNonNullElse(batch.timer.value, "00:00")),
                LogFields.cleanUser(Objects.requireNonNullElse(batch.timer.sessionType, "unknown")));
        }

        Set<String> users = new LinkedHashSet<>();
        if (batch.users != null) {
            batch.users.stream()
                .map(LogFields::cleanUser)
                .filter(u -> !u.isEmpty())
                .forEach(users::add);
        }
        String presenceLine = String.format("%s,%d,\"%s\"", scrapeTime, users.size(), String.join(";", users));

        List<ScrapeBatch.ScrapedActivity> activities = batch.activities != null ? batch.activities : List.of();
        Set<String> existing = loadExistingKeys();
        List<String> newLines = new ArrayList<>();

        for (ScrapeBatch.ScrapedActivity activity : activities) {
            if (activity == null) continue;
            String user = LogFields.cleanUser(activity.user);
            if (user.isEmpty() || systemActors.contains(user)) continue;

            String action = LogFields.cleanAction(activity.action);
            String timeAgo = LogFields.cleanTimeAgo(activity.timeAgo);
            Instant estimated = TimeAgo.estimate(scrapeTime, timeAgo);

            if (existing.add(DedupKey.of(estimated, user, action, timeAgo))) {
                newLines.add(estimated + "," + scrapeTime + "," + user + "," + action + "," + timeAgo);
            }
        }

        if (timerLine != null) {
            appendLines(SNAPSHOTS_FILE, SNAPSHOTS_HEADER, List.of(timerLine));
        }
        appendLines(PRESENCE_FILE, PRESENCE_HEADER, List.of(presenceLine));
        if (!newLines.isEmpty()) {
            appendLines(ACTIVITIES_FILE, ACTIVITIES_HEADER, newLines);
        } else {
            ensureHeader(ACTIVITIES_FILE, ACTIVITIES_HEADER);
        }

        ScrapeReceipt receipt = new ScrapeReceipt(scrapeTime, activities.size(), newLines.size(), users.size());
        LOG.infof("Recorded scrape at %s: %d users present, %d/%d activities new",
            scrapeTime, users.size(), newLines.size(), activities.size());
        return receipt;
    }

    /**
     * Replace a derived document wholesale.
     */
    public void writeDocument(String fileName, String content) {
        Path file = path(fileName);
        try {
            Files.createDirectories(dataDir);
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LogStoreException("Failed to write " + file, e);
        }
    }

    private void appendLines(String fileName, String header, List<String> lines) {
        ensureHeader(fileName, header);
        String content = lines.stream().map(l -> l + "\n").collect(Collectors.joining());
        try {
            Files.writeString(path(fileName), content, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new LogStoreException("Failed to append to " + path(fileName), e);
        }
    }

    private void ensureHeader(String fileName, String header) {
        Path file = path(fileName);
        if (Files.exists(file)) return;
        try {
            Files.createDirectories(dataDir);
            Files.writeString(file, header + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LogStoreException("Failed to create " + file, e);
        }
    }
}
