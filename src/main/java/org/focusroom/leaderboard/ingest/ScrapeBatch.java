package org.focusroom.leaderboard.ingest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the collector observed in one visit to the room.
 */
public class ScrapeBatch {
    public Instant scrapeTime;  // defaults to "now" when absent
    public List<String> users = new ArrayList<>();
    public List<ScrapedActivity> activities = new ArrayList<>();
    public TimerState timer;

    public static class ScrapedActivity {
        public String user;
        public String action;
        public String timeAgo;

        public ScrapedActivity() {
        }

        public ScrapedActivity(String user, String action, String timeAgo) {
            this.user = user;
            this.action = action;
            this.timeAgo = timeAgo;
        }
    }

    public static class TimerState {
        public boolean running;
        public String value;
        public String sessionType;

        public TimerState() {
        }

        public TimerState(boolean running, String value, String sessionType) {
            this.running = running;
            this.value = value;
            this.sessionType = sessionType;
        }
    }
}
