package org.focusroom.leaderboard.model;

public enum TimerType {
    WORK,
    BREAK;

    public String label() {
        return name().toLowerCase();
    }
}
