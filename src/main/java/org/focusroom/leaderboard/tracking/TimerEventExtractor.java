package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.ActivityRecord;
import org.focusroom.leaderboard.model.TimerEvent;
import org.focusroom.leaderboard.model.TimerType;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Extracts work/break timer starts from the activity feed.
 */
public class TimerEventExtractor {

    private static final Logger LOG = Logger.getLogger(TimerEventExtractor.class);

    private final ActivityClassifier classifier;
    private final Set<String> systemActors;

    public TimerEventExtractor(ActivityClassifier classifier, Set<String> systemActors) {
        this.classifier = classifier;
        this.systemActors = Set.copyOf(systemActors);
    }

    /**
     * Timer events sorted by start time; records from system actors and text that is
     * not a timer start produce nothing.
     */
    public List<TimerEvent> extract(List<ActivityRecord> activities) {
        List<TimerEvent> events = new ArrayList<>();

        for (ActivityRecord record : activities) {
            if (isSystemActor(record.user)) continue;

            ActivityClassification classification = classifier.classify(record.action);
            if (!classification.isTimerStart()) continue;

            if (classification.durationMinutes <= 0) {
                LOG.debugf("Ignoring zero-length timer start: %s", record);
                continue;
            }

            TimerType type = classification.kind == ActivityClassification.Kind.BREAK_START
                ? TimerType.BREAK
                : TimerType.WORK;
            events.add(new TimerEvent(record.estimatedTime, type, classification.durationMinutes, record.user));
        }

        events.sort(Comparator.comparing(e -> e.startTime));
        return events;
    }

    public boolean isSystemActor(String user) {
        return user == null || user.isBlank() || systemActors.contains(user);
    }

    public ActivityClassifier getClassifier() {
        return classifier;
    }
}
