package org.focusroom.leaderboard;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;

/**
 * Settings under the {@code leaderboard.} prefix in application.properties.
 */
@ConfigMapping(prefix = "leaderboard")
public interface LeaderboardConfig {

    /**
     * Directory holding the raw logs and the generated documents.
     */
    @WithDefault("data")
    String dataDir();

    /**
     * Minutes after a timer start during which a joining user still gets the timer counted.
     */
    @WithDefault("5")
    int graceMinutes();

    /**
     * Longest stretch between two snapshots that is credited as presence for a new arrival.
     */
    @WithDefault("30")
    int gapCapMinutes();

    /**
     * Feed authors that are not room members.
     */
    @WithDefault("unknown,cuckoo")
    List<String> systemActors();

    @WithDefault("false")
    boolean computeOnStart();

    @WithDefault("true")
    boolean writeMarkdownReport();
}
