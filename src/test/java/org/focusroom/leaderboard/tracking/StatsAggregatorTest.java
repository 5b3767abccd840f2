package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.PresenceWindow;
import org.focusroom.leaderboard.model.TimerEvent;
import org.focusroom.leaderboard.model.TimerType;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for per-user aggregation and ranking.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class StatsAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final StatsAggregator aggregator = new StatsAggregator(new AttributionEngine());

    private static Instant at(int minute) {
        return T0.plusSeconds(minute * 60L);
    }

    private static PresenceWindow window(String user, int joinMinute, int leaveMinute) {
        return PresenceWindow.closed(user, at(joinMinute), at(leaveMinute));
    }

    @Test
    @Order(1)
    @DisplayName("Should total presence, counts and minutes per user")
    void testTotals() {
        Map<String, List<PresenceWindow>> windows = new LinkedHashMap<>();
        windows.put("x", List.of(window("x", -5, 30), window("x", 40, 50)));
        windows.put("y", List.of(window("y", 3, 40)));

        List<TimerEvent> timers = List.of(
            new TimerEvent(T0, TimerType.WORK, 25, "x"),
            new TimerEvent(at(25), TimerType.BREAK, 5, "x")
        );

        List<UserStats> stats = aggregator.aggregate(windows, timers, Set.of("y"));

        UserStats x = stats.stream().filter(s -> s.user.equals("x")).findFirst().orElseThrow();
        assertEquals(45.0, x.totalPresenceMinutes, 1e-9);
        assertEquals(1, x.pomodoroCount);
        assertEquals(25.0, x.totalWorkMinutes, 1e-9);
        assertEquals(1, x.breakCount);
        assertEquals(5.0, x.totalBreakMinutes, 1e-9);
        assertEquals(at(-5), x.firstSeen);
        assertEquals(at(50), x.lastSeen);
        assertFalse(x.currentlyPresent);

        UserStats y = stats.stream().filter(s -> s.user.equals("y")).findFirst().orElseThrow();
        assertEquals(1, y.pomodoroCount);          // grace-period latecomer
        assertEquals(22.0, y.totalWorkMinutes, 1e-9);
        assertEquals(1, y.breakCount);
        assertEquals(22.0, y.avgPomodoroMinutes(), 1e-9);
        assertTrue(y.currentlyPresent);
    }

    @Test
    @Order(2)
    @DisplayName("Averages should be zero when there are no timers")
    void testZeroAverages() {
        List<UserStats> stats = aggregator.aggregate(Map.of("a", List.of(window("a", 0, 10))), List.of(), Set.of());

        assertEquals(0, stats.get(0).pomodoroCount);
        assertEquals(0.0, stats.get(0).avgPomodoroMinutes());
        assertEquals(0.0, stats.get(0).avgBreakMinutes());
    }

    @Test
    @Order(3)
    @DisplayName("Ranking should be by presence descending with ties in encounter order")
    void testStableRanking() {
        Map<String, List<PresenceWindow>> windows = new LinkedHashMap<>();
        windows.put("first", List.of(window("first", 0, 10)));
        windows.put("longest", List.of(window("longest", 0, 60)));
        windows.put("second", List.of(window("second", 20, 30)));
        windows.put("third", List.of(window("third", 40, 50)));

        List<UserStats> stats = aggregator.aggregate(windows, List.of(), Set.of());

        assertEquals(List.of("longest", "first", "second", "third"),
            stats.stream().map(s -> s.user).toList());
    }

    @Test
    @Order(4)
    @DisplayName("Timer nobody attended should contribute nothing")
    void testUnattendedTimer() {
        List<UserStats> stats = aggregator.aggregate(
            Map.of("a", List.of(window("a", 0, 10))),
            List.of(new TimerEvent(at(100), TimerType.WORK, 25, "ghost")),
            Set.of());

        assertEquals(0, stats.get(0).pomodoroCount);
        assertEquals(0.0, stats.get(0).totalWorkMinutes);
    }
}
