package org.focusroom.leaderboard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.focusroom.leaderboard.ingest.LogStore;
import org.focusroom.leaderboard.ingest.LogStoreException;
import org.focusroom.leaderboard.ingest.ScrapeBatch;
import org.focusroom.leaderboard.ingest.ScrapeReceipt;
import org.focusroom.leaderboard.model.ActivityRecord;
import org.focusroom.leaderboard.model.PresenceSnapshot;
import org.focusroom.leaderboard.model.TimerSnapshot;
import org.focusroom.leaderboard.report.LeaderboardDocument;
import org.focusroom.leaderboard.report.LeaderboardReport;
import org.focusroom.leaderboard.report.SessionLogDocument;
import org.focusroom.leaderboard.tracking.ActivityClassifier;
import org.focusroom.leaderboard.tracking.EngagementEngine;
import org.focusroom.leaderboard.tracking.EngagementResult;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns the raw log store and runs the engagement engine over it.
 * Each refresh is a full batch recomputation that overwrites every derived document.
 */
@ApplicationScoped
public class LeaderboardManager {

    private static final Logger LOG = Logger.getLogger(LeaderboardManager.class);

    public static final String SESSION_LOG_FILE = "session_log.json";
    public static final String LEADERBOARD_FILE = "leaderboard.json";
    public static final String REPORT_FILE = "leaderboard.md";

    @Inject
    LeaderboardConfig config;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    private LogStore logStore;
    private EngagementEngine engine;
    private Set<String> systemActors;

    private volatile LeaderboardDocument latestLeaderboard;
    private volatile SessionLogDocument latestSessionLog;

    @PostConstruct
    void init() {
        this.logStore = new LogStore(Path.of(config.dataDir()));
        this.systemActors = config.systemActors().stream()
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        this.engine = new EngagementEngine(
            ActivityClassifier.withDefaultRules(),
            systemActors,
            Duration.ofMinutes(config.graceMinutes()),
            Duration.ofMinutes(config.gapCapMinutes())
        );
    }

    void onStart(@Observes StartupEvent ev) {
        LOG.infof("LeaderboardManager initialized - data dir %s, grace %dm, gap cap %dm",
            logStore.getDataDir().toAbsolutePath(), config.graceMinutes(), config.gapCapMinutes());

        if (config.computeOnStart()) {
            try {
                refresh();
            } catch (LogStoreException e) {
                LOG.error("Initial leaderboard computation failed: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Recompute everything from the raw logs and overwrite the documents.
     */
    public synchronized LeaderboardDocument refresh() {
        LogStore.RawLogs logs = logStore.readAll();
        List<ActivityRecord> activities = logs.activities;
        List<PresenceSnapshot> presence = logs.presence;
        List<TimerSnapshot> timerSnapshots = logs.timerSnapshots;

        LOG.infof("Processing logs: %d activities, %d presence snapshots, %d timer snapshots",
            activities.size(), presence.size(), timerSnapshots.size());

        Instant now = clock.instant();
        EngagementResult result = engine.compute(activities, presence, timerSnapshots, now);

        SessionLogDocument sessionLog = SessionLogDocument.from(result, now);
        LeaderboardDocument leaderboard = LeaderboardDocument.from(result, now);

        logStore.writeDocument(SESSION_LOG_FILE, toJson(sessionLog));
        logStore.writeDocument(LEADERBOARD_FILE, toJson(leaderboard));
        if (config.writeMarkdownReport()) {
            logStore.writeDocument(REPORT_FILE, LeaderboardReport.render(leaderboard));
        }

        latestSessionLog = sessionLog;
        latestLeaderboard = leaderboard;

        LOG.infof("Leaderboard updated: %d timers, %d users tracked, %d currently present",
            result.timerEvents.size(), leaderboard.totalUsers, leaderboard.currentlyPresent.size());
        return leaderboard;
    }

    public LeaderboardDocument getLeaderboard() {
        LeaderboardDocument current = latestLeaderboard;
        return current != null ? current : refresh();
    }

    public SessionLogDocument getSessionLog() {
        if (latestSessionLog == null) {
            refresh();
        }
        return latestSessionLog;
    }

    public String renderReport() {
        return LeaderboardReport.render(getLeaderboard());
    }

    public ScrapeReceipt recordScrape(ScrapeBatch batch) {
        return logStore.appendScrape(batch, clock.instant(), systemActors);
    }

    public LogStore getLogStore() {
        return logStore;
    }

    private String toJson(Object document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new LogStoreException("Failed to serialize " + document.getClass().getSimpleName(), e);
        }
    }
}
