package org.focusroom.leaderboard.tracking;

import org.focusroom.leaderboard.model.PresenceWindow;
import org.focusroom.leaderboard.model.TimerEvent;
import org.focusroom.leaderboard.model.TimerType;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for timer eligibility and presence overlap.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class AttributionEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final TimerEvent WORK_25 = new TimerEvent(T0, TimerType.WORK, 25, "x");

    private final AttributionEngine engine = new AttributionEngine();

    private static Instant at(int minute) {
        return T0.plusSeconds(minute * 60L);
    }

    private static PresenceWindow window(int joinMinute, int leaveMinute) {
        return PresenceWindow.closed("u", at(joinMinute), at(leaveMinute));
    }

    @Test
    @Order(1)
    @DisplayName("User present through the whole timer should be eligible with full overlap")
    void testPresentAtStart() {
        List<PresenceWindow> x = List.of(window(-5, 30));

        assertTrue(engine.eligibleForTimerCount(x, WORK_25.startTime));
        assertEquals(25.0, engine.overlapMinutes(x, WORK_25.startTime, WORK_25.endTime), 1e-9);
    }

    @Test
    @Order(2)
    @DisplayName("Latecomer within grace should be counted with partial overlap")
    void testLatecomerWithinGrace() {
        List<PresenceWindow> y = List.of(window(3, 40));

        assertTrue(engine.eligibleForTimerCount(y, WORK_25.startTime));
        assertEquals(22.0, engine.overlapMinutes(y, WORK_25.startTime, WORK_25.endTime), 1e-9);
    }

    @Test
    @Order(3)
    @DisplayName("Grace period should be inclusive at exactly five minutes")
    void testGraceBoundary() {
        assertTrue(engine.eligibleForTimerCount(List.of(window(5, 40)), WORK_25.startTime));
        assertFalse(engine.eligibleForTimerCount(
            List.of(PresenceWindow.closed("u", at(5).plusSeconds(1), at(40))), WORK_25.startTime));
    }

    @Test
    @Order(4)
    @DisplayName("Joining after the grace period should earn minutes but no count")
    void testOverlapWithoutEligibility() {
        List<PresenceWindow> z = List.of(window(6, 40));

        assertFalse(engine.eligibleForTimerCount(z, WORK_25.startTime));
        assertEquals(19.0, engine.overlapMinutes(z, WORK_25.startTime, WORK_25.endTime), 1e-9);
    }

    @Test
    @Order(5)
    @DisplayName("Eligible user may have almost no overlap")
    void testEligibleWithTinyOverlap() {
        // present at the start, left ten seconds later
        List<PresenceWindow> w = List.of(PresenceWindow.closed("u", at(-10), T0.plusSeconds(10)));

        assertTrue(engine.eligibleForTimerCount(w, WORK_25.startTime));
        double overlap = engine.overlapMinutes(w, WORK_25.startTime, WORK_25.endTime);
        assertTrue(overlap > 0 && overlap < 0.2, "overlap was " + overlap);
    }

    @Test
    @Order(6)
    @DisplayName("Window ending before the timer should be neither eligible nor overlapping")
    void testDisjoint() {
        List<PresenceWindow> early = List.of(window(-30, -1));

        assertFalse(engine.eligibleForTimerCount(early, WORK_25.startTime));
        assertEquals(0.0, engine.overlapMinutes(early, WORK_25.startTime, WORK_25.endTime), 1e-9);
        assertFalse(engine.eligibleForTimerCount(List.of(), WORK_25.startTime));
    }

    @Test
    @Order(7)
    @DisplayName("Overlap should sum across several windows")
    void testMultipleWindows() {
        List<PresenceWindow> windows = List.of(window(-5, 5), window(10, 15), window(20, 60));

        assertEquals(5.0 + 5.0 + 5.0, engine.overlapMinutes(windows, WORK_25.startTime, WORK_25.endTime), 1e-9);
    }

    @Test
    @Order(8)
    @DisplayName("Overlap should never exceed the timer duration or the presence total")
    void testOverlapBounds() {
        List<List<PresenceWindow>> cases = List.of(
            List.of(window(-60, 120)),
            List.of(window(1, 2)),
            List.of(window(-5, 5), window(10, 15), window(20, 60)),
            List.of(window(24, 26), window(25, 25)),
            List.of()
        );

        for (List<PresenceWindow> windows : cases) {
            double overlap = engine.overlapMinutes(windows, WORK_25.startTime, WORK_25.endTime);
            double presence = windows.stream().mapToDouble(PresenceWindow::durationMinutes).sum();
            assertTrue(overlap <= WORK_25.durationMinutes + 1e-9);
            assertTrue(overlap <= presence + 1e-9);
            assertTrue(overlap >= 0);
        }
    }

    @Test
    @Order(9)
    @DisplayName("Open window should count as lasting past the timer")
    void testOpenWindow() {
        List<PresenceWindow> open = List.of(PresenceWindow.open("u", at(10)));

        assertFalse(engine.eligibleForTimerCount(open, WORK_25.startTime));
        assertEquals(15.0, engine.overlapMinutes(open, WORK_25.startTime, WORK_25.endTime), 1e-9);
        assertTrue(engine.eligibleForTimerCount(open, at(10)));
    }
}
