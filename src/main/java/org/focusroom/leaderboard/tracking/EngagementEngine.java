package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.ActivityRecord;
import org.focusroom.leaderboard.model.PresenceSnapshot;
import org.focusroom.leaderboard.model.PresenceWindow;
import org.focusroom.leaderboard.model.TimerEvent;
import org.focusroom.leaderboard.model.TimerSnapshot;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batch recomputation of engagement from the full raw logs:
 * timer extraction, presence windows, attribution and ranking.
 * Holds no state between runs; the same logs and the same {@code now} give the same result.
 */
public class EngagementEngine {

    private static final Logger LOG = Logger.getLogger(EngagementEngine.class);

    public static final Set<String> DEFAULT_SYSTEM_ACTORS = Set.of("unknown", "cuckoo");

    private final TimerEventExtractor timerExtractor;
    private final PresenceWindowBuilder windowBuilder;
    private final StatsAggregator aggregator;

    public EngagementEngine(ActivityClassifier classifier, Set<String> systemActors,
                            Duration gracePeriod, Duration gapCap) {
        this.timerExtractor = new TimerEventExtractor(classifier, systemActors);
        this.windowBuilder = new PresenceWindowBuilder(gapCap);
        this.aggregator = new StatsAggregator(new AttributionEngine(gracePeriod));
    }

    public static EngagementEngine withDefaults() {
        return new EngagementEngine(ActivityClassifier.withDefaultRules(), DEFAULT_SYSTEM_ACTORS,
            AttributionEngine.DEFAULT_GRACE_PERIOD, PresenceWindowBuilder.DEFAULT_GAP_CAP);
    }

    /**
     * @param activities      activity log records
     * @param presence        presence snapshots in timestamp order
     * @param timerSnapshots  timer snapshots in timestamp order
     * @param now             closing time for windows still open after the last snapshot
     */
    public EngagementResult compute(List<ActivityRecord> activities, List<PresenceSnapshot> presence,
                                    List<TimerSnapshot> timerSnapshots, Instant now) {
        List<TimerEvent> timers = timerExtractor.extract(activities);

        JoinEventIndex joins = JoinEventIndex.from(activities, timerExtractor.getClassifier(),
            timerExtractor::isSystemActor);
        Map<String, List<PresenceWindow>> windows = windowBuilder.build(presence, joins, now);

        List<String> currentlyPresent = presence.isEmpty()
            ? List.of()
            : new ArrayList<>(presence.get(presence.size() - 1).usersPresent);
        List<UserStats> ranked = aggregator.aggregate(windows, timers, Set.copyOf(currentlyPresent));

        TimerSnapshot latestTimer = timerSnapshots.isEmpty() ? null : timerSnapshots.get(timerSnapshots.size() - 1);

        LOG.debugf("Computed engagement: %d activities, %d snapshots, %d timers, %d precise joins, %d users",
            activities.size(), presence.size(), timers.size(), joins.getJoinCount(), ranked.size());

        return new EngagementResult(now, timers, windows, ranked, currentlyPresent, latestTimer);
    }
}
