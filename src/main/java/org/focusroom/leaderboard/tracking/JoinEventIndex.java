package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.ActivityRecord;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Precise join times mined from the activity feed ("... joined the room"), per user.
 */
public class JoinEventIndex {

    public static final JoinEventIndex EMPTY = new JoinEventIndex(Collections.emptyMap());

    private final Map<String, NavigableSet<Instant>> joinsByUser;

    private JoinEventIndex(Map<String, NavigableSet<Instant>> joinsByUser) {
        this.joinsByUser = joinsByUser;
    }

    public static JoinEventIndex from(Iterable<ActivityRecord> activities, ActivityClassifier classifier,
                                      Predicate<String> isSystemActor) {
        Map<String, NavigableSet<Instant>> index = new HashMap<>();
        for (ActivityRecord record : activities) {
            if (isSystemActor.test(record.user)) continue;
            if (classifier.classify(record.action).kind != ActivityClassification.Kind.JOIN) continue;
            index.computeIfAbsent(record.user, k -> new TreeSet<>()).add(record.estimatedTime);
        }
        return new JoinEventIndex(index);
    }

    public static JoinEventIndex of(Map<String, ? extends Iterable<Instant>> joins) {
        Map<String, NavigableSet<Instant>> index = new HashMap<>();
        joins.forEach((user, times) -> {
            NavigableSet<Instant> set = new TreeSet<>();
            times.forEach(set::add);
            index.put(user, set);
        });
        return new JoinEventIndex(index);
    }

    /**
     * Earliest join of {@code user} strictly after {@code after} and at or before {@code upTo}.
     * Returns null when the feed has none in that range.
     */
    public Instant findJoin(String user, Instant after, Instant upTo) {
        NavigableSet<Instant> joins = joinsByUser.get(user);
        if (joins == null) return null;
        Instant candidate = joins.higher(after);
        return candidate != null && !candidate.isAfter(upTo) ? candidate : null;
    }

    public int getUserCount() {
        return joinsByUser.size();
    }

    public int getJoinCount() {
        return joinsByUser.values().stream().mapToInt(NavigableSet::size).sum();
    }
}
