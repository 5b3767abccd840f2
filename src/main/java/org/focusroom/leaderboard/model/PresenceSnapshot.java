package org.focusroom.leaderboard.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Room membership sampled at a single point in time.
 */
public class PresenceSnapshot {
    public final Instant timestamp;
    public final Set<String> usersPresent;

    public PresenceSnapshot(Instant timestamp, Set<String> usersPresent) {
        this.timestamp = timestamp;
        this.usersPresent = Collections.unmodifiableSet(new LinkedHashSet<>(usersPresent));
    }

    public boolean contains(String user) {
        return usersPresent.contains(user);
    }

    @Override
    public String toString() {
        return "PresenceSnapshot{timestamp=" + timestamp + ", users=" + usersPresent + "}";
    }
}
