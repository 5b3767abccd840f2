package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.PresenceSnapshot;
import org.focusroom.leaderboard.model.PresenceWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable accumulator of the presence fold: every user's windows so far (in order of
 * first appearance) and the snapshot that was folded last.
 * Each {@link #step} returns a new state; nothing is changed in place.
 */
public final class PresenceState {

    static final Duration JOIN_LEAVE_OFFSET = Duration.ofSeconds(1);

    private static final PresenceState INITIAL = new PresenceState(Collections.emptyMap(), null);

    private final Map<String, List<PresenceWindow>> windows;
    private final PresenceSnapshot previous;

    private PresenceState(Map<String, List<PresenceWindow>> windows, PresenceSnapshot previous) {
        this.windows = windows;
        this.previous = previous;
    }

    public static PresenceState initial() {
        return INITIAL;
    }

    /**
     * Fold one snapshot: users newly present get an open window, users no longer
     * present get their open window closed one second before this snapshot.
     */
    public PresenceState step(PresenceSnapshot current, JoinEventIndex joins, Duration gapCap) {
        Map<String, List<PresenceWindow>> next = new LinkedHashMap<>(windows);
        Set<String> before = previous == null ? Set.of() : previous.usersPresent;

        for (String user : current.usersPresent) {
            if (before.contains(user)) continue;
            Instant joinTime = resolveJoinTime(user, current, joins, gapCap);
            next.put(user, append(next.get(user), PresenceWindow.open(user, joinTime)));
        }

        for (String user : before) {
            if (current.contains(user)) continue;
            List<PresenceWindow> userWindows = next.get(user);
            if (userWindows == null || userWindows.isEmpty()) continue;

            PresenceWindow last = userWindows.get(userWindows.size() - 1);
            if (last.isOpen()) {
                next.put(user, replaceLast(userWindows, last.close(current.timestamp.minus(JOIN_LEAVE_OFFSET))));
            }
        }

        return new PresenceState(Collections.unmodifiableMap(next), current);
    }

    /**
     * Close every window still open at the end of the log at {@code now}, flagged still present.
     */
    public PresenceState finish(Instant now) {
        Map<String, List<PresenceWindow>> next = new LinkedHashMap<>(windows);
        windows.forEach((user, userWindows) -> {
            PresenceWindow last = userWindows.get(userWindows.size() - 1);
            if (last.isOpen()) {
                next.put(user, replaceLast(userWindows, last.closeStillPresent(now)));
            }
        });
        return new PresenceState(Collections.unmodifiableMap(next), previous);
    }

    /**
     * Precise join from the feed when one falls in (previous, current]; otherwise one second
     * after the previous snapshot, or gapCap before the current one when the gap is longer.
     */
    private Instant resolveJoinTime(String user, PresenceSnapshot current, JoinEventIndex joins, Duration gapCap) {
        if (previous == null) {
            return current.timestamp;
        }

        Instant precise = joins.findJoin(user, previous.timestamp, current.timestamp);
        if (precise != null) {
            return precise;
        }

        Duration gap = Duration.between(previous.timestamp, current.timestamp);
        Instant synthesized = gap.compareTo(gapCap) > 0
            ? current.timestamp.minus(gapCap)
            : previous.timestamp.plus(JOIN_LEAVE_OFFSET);
        return synthesized.isAfter(current.timestamp) ? current.timestamp : synthesized;
    }

    private static List<PresenceWindow> append(List<PresenceWindow> existing, PresenceWindow window) {
        List<PresenceWindow> copy = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        copy.add(window);
        return Collections.unmodifiableList(copy);
    }

    private static List<PresenceWindow> replaceLast(List<PresenceWindow> existing, PresenceWindow window) {
        List<PresenceWindow> copy = new ArrayList<>(existing);
        copy.set(copy.size() - 1, window);
        return Collections.unmodifiableList(copy);
    }

    public Map<String, List<PresenceWindow>> getWindows() {
        return windows;
    }

    public List<PresenceWindow> getWindows(String user) {
        return windows.getOrDefault(user, List.of());
    }

    public PresenceSnapshot getPrevious() {
        return previous;
    }

    public long getOpenWindowCount() {
        return windows.values().stream()
            .filter(list -> list.get(list.size() - 1).isOpen())
            .count();
    }
}
