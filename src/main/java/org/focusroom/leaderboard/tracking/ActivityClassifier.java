package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.tracking.ActivityClassification.Kind;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies free-text activity feed lines with an ordered list of rules.
 * The first rule whose pattern is found in the text decides the outcome; for timer
 * starts the first capture group holds the duration in minutes.
 */
public class ActivityClassifier {

    public static class Rule {
        public final Pattern pattern;
        public final Kind outcome;

        public Rule(String regex, Kind outcome) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            this.outcome = outcome;
        }

        @Override
        public String toString() {
            return outcome + " <- /" + pattern.pattern() + "/";
        }
    }

    private final List<Rule> rules;

    public ActivityClassifier(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Work and break starts first (explicit keyword wins), then a bare
     * "started N minute" falls back to work; stops and joins after that.
     */
    public static List<Rule> defaultRules() {
        return List.of(
            new Rule("started.*?(\\d+)[\\s-]*minute.*?work", Kind.WORK_START),
            new Rule("started.*?(\\d+)[\\s-]*minute.*?break", Kind.BREAK_START),
            new Rule("^(?=.*break).*?started.*?(\\d+)[\\s-]*minute", Kind.BREAK_START),
            new Rule("started.*?(\\d+)[\\s-]*minute", Kind.WORK_START),
            new Rule("stopped|skipped", Kind.STOP),
            new Rule("joined", Kind.JOIN)
        );
    }

    public static ActivityClassifier withDefaultRules() {
        return new ActivityClassifier(defaultRules());
    }

    public ActivityClassification classify(String text) {
        if (text == null || text.isBlank()) {
            return ActivityClassification.UNRECOGNIZED;
        }

        for (Rule rule : rules) {
            Matcher m = rule.pattern.matcher(text);
            if (!m.find()) continue;

            if (rule.outcome == Kind.WORK_START || rule.outcome == Kind.BREAK_START) {
                return new ActivityClassification(rule.outcome, parseMinutes(m));
            }
            return new ActivityClassification(rule.outcome, 0);
        }
        return ActivityClassification.UNRECOGNIZED;
    }

    public List<Rule> getRules() {
        return rules;
    }

    private static int parseMinutes(Matcher m) {
        if (m.groupCount() < 1 || m.group(1) == null) return 0;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // more digits than an int holds; not a real timer
            return 0;
        }
    }
}
