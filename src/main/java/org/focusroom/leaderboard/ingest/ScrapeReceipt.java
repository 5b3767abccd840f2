package org.focusroom.leaderboard.ingest;

import java.time.Instant;

/**
 * What a scrape batch added to the logs.
 */
public class ScrapeReceipt {
    public final Instant scrapeTime;
    public final int activitiesSeen;
    public final int newActivities;
    public final int usersPresent;

    public ScrapeReceipt(Instant scrapeTime, int activitiesSeen, int newActivities, int usersPresent) {
        this.scrapeTime = scrapeTime;
        this.activitiesSeen = activitiesSeen;
        this.newActivities = newActivities;
        this.usersPresent = usersPresent;
    }

    @Override
    public String toString() {
        return String.format("ScrapeReceipt{scrapeTime=%s, seen=%d, new=%d, present=%d}",
            scrapeTime, activitiesSeen, newActivities, usersPresent);
    }
}
