package org.focusroom.leaderboard.report;

/**
 * Renders a leaderboard document as a markdown page.
 */
public final class LeaderboardReport {

    private LeaderboardReport() {}

    public static String render(LeaderboardDocument doc) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Focus Room Leaderboard\n\n");
        sb.append("Generated: ").append(doc.generated).append("\n\n");

        sb.append("## Currently Present\n\n");
        if (doc.currentlyPresent.isEmpty()) {
            sb.append("No one currently in room\n\n");
        } else {
            sb.append(String.join(", ", doc.currentlyPresent)).append("\n\n");
        }

        if (doc.timer != null) {
            sb.append("Timer: ").append(doc.timer.value)
              .append(" (").append(doc.timer.running ? "running" : "stopped")
              .append(", ").append(doc.timer.sessionType).append(")\n\n");
        }

        sb.append("## Ranking\n\n");
        if (doc.users.isEmpty()) {
            sb.append("No activity recorded yet.\n");
            return sb.toString();
        }

        sb.append("| # | User | Presence | Work | Pomodoros | Breaks | Avg Pomodoro |\n");
        sb.append("|---:|---|---:|---:|---:|---:|---:|\n");
        int rank = 1;
        for (LeaderboardDocument.Entry e : doc.users) {
            sb.append("| ").append(rank++)
              .append(" | ").append(escape(e.user)).append(e.currentlyPresent ? " (online)" : "")
              .append(" | ").append(DurationFormat.format(e.totalPresenceMinutes))
              .append(" | ").append(DurationFormat.format(e.totalWorkMinutes))
              .append(" | ").append(e.pomodoroCount)
              .append(" | ").append(e.breakCount)
              .append(" | ").append(DurationFormat.format(e.avgPomodoroMinutes))
              .append(" |\n");
        }

        sb.append("\n")
          .append(doc.totalUsers).append(" users, ")
          .append(doc.totalPomodoros).append(" pomodoros, ")
          .append(DurationFormat.format(doc.totalWorkMinutes)).append(" of focused work\n");
        return sb.toString();
    }

    private static String escape(String cell) {
        return cell.replace("|", "\\|");
    }
}
