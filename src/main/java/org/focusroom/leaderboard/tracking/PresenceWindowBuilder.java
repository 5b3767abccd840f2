package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.PresenceSnapshot;
import org.focusroom.leaderboard.model.PresenceWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Infers continuous presence windows from discrete room snapshots.
 */
public class PresenceWindowBuilder {

    public static final Duration DEFAULT_GAP_CAP = Duration.ofMinutes(30);

    private final Duration gapCap;

    public PresenceWindowBuilder(Duration gapCap) {
        this.gapCap = gapCap;
    }

    public PresenceWindowBuilder() {
        this(DEFAULT_GAP_CAP);
    }

    /**
     * Fold the snapshots in order. Windows of users present in the last snapshot stay open.
     */
    public PresenceState fold(List<PresenceSnapshot> snapshots, JoinEventIndex joins) {
        PresenceState state = PresenceState.initial();
        for (PresenceSnapshot snapshot : snapshots) {
            state = state.step(snapshot, joins, gapCap);
        }
        return state;
    }

    /**
     * Windows per user with every window closed; those open after the last snapshot end at {@code now}.
     */
    public Map<String, List<PresenceWindow>> build(List<PresenceSnapshot> snapshots, JoinEventIndex joins, Instant now) {
        return fold(snapshots, joins).finish(now).getWindows();
    }

    public Duration getGapCap() {
        return gapCap;
    }
}
