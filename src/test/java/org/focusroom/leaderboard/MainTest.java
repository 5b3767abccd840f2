package org.focusroom.leaderboard;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the REST API: ingest scrapes, recompute, read documents.
 */
@QuarkusTest
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class MainTest {

    @Inject
    LeaderboardManager leaderboardManager;

    private static final String FIRST_SCRAPE = """
        {
          "scrapeTime": "2024-05-01T10:00:00Z",
          "users": ["alice"],
          "activities": [
            {"user": "alice", "action": "started a 25 minute work session", "timeAgo": "1 min ago"},
            {"user": "cuckoo", "action": "Time to focus!", "timeAgo": "1 min ago"}
          ],
          "timer": {"running": true, "value": "24:00", "sessionType": "work"}
        }
        """;

    private static final String SECOND_SCRAPE = """
        {
          "scrapeTime": "2024-05-01T10:10:00Z",
          "users": ["alice", "bob"],
          "activities": [
            {"user": "bob", "action": "joined the room", "timeAgo": "2 min ago"},
            {"user": "alice", "action": "started a 25 minute work session", "timeAgo": "11 min ago"}
          ],
          "timer": {"running": true, "value": "14:00", "sessionType": "work"}
        }
        """;

    @BeforeEach
    void setUp() throws IOException {
        Path dataDir = leaderboardManager.getLogStore().getDataDir();
        if (Files.exists(dataDir)) {
            try (Stream<Path> files = Files.walk(dataDir)) {
                files.sorted(Comparator.reverseOrder())
                    .filter(p -> !p.equals(dataDir))
                    .forEach(p -> p.toFile().delete());
            }
        }
    }

    @Test
    @Order(1)
    @DisplayName("Health endpoint should return OK with data directory")
    void testHealthEndpoint() {
        given()
            .when().get("/health")
            .then()
                .statusCode(200)
                .body("status", is("ok"))
                .body("dataDir", notNullValue())
                .body("timestamp", notNullValue());
    }

    @Test
    @Order(2)
    @DisplayName("Refresh on empty logs should return a valid empty leaderboard")
    void testEmptyLeaderboard() {
        given()
            .when().post("/leaderboard/refresh")
            .then()
                .statusCode(200)
                .contentType("application/json")
                .body("totalUsers", is(0))
                .body("totalPomodoros", is(0))
                .body("currentlyPresent", hasSize(0))
                .body("users", hasSize(0))
                .body("generated", notNullValue());
    }

    @Test
    @Order(3)
    @DisplayName("Scrape ingestion should deduplicate the feed across visits")
    void testScrapeIngestion() {
        given()
            .contentType(ContentType.JSON)
            .body(FIRST_SCRAPE)
            .when().post("/ingest/scrape")
            .then()
                .statusCode(200)
                .body("activitiesSeen", is(2))
                .body("newActivities", is(1))
                .body("usersPresent", is(1));

        given()
            .contentType(ContentType.JSON)
            .body(SECOND_SCRAPE)
            .when().post("/ingest/scrape")
            .then()
                .statusCode(200)
                .body("newActivities", is(1))
                .body("usersPresent", is(2));

        assertEquals(2, leaderboardManager.getLogStore().readActivities().size());
        assertEquals(2, leaderboardManager.getLogStore().readPresence().size());
        assertEquals(2, leaderboardManager.getLogStore().readTimerSnapshots().size());
    }

    @Test
    @Order(4)
    @DisplayName("Refresh should rank users and write all documents")
    void testRefreshAfterScrapes() {
        given().contentType(ContentType.JSON).body(FIRST_SCRAPE).post("/ingest/scrape");
        given().contentType(ContentType.JSON).body(SECOND_SCRAPE).post("/ingest/scrape");

        given()
            .when().post("/leaderboard/refresh")
            .then()
                .statusCode(200)
                .body("totalUsers", is(2))
                .body("currentlyPresent", hasItems("alice", "bob"))
                .body("totalPomodoros", is(1))
                .body("timer.value", is("14:00"))
                .body("users[0].user", is("alice"))
                .body("users[0].pomodoroCount", is(1))
                .body("users[0].totalWorkMinutes", is(24))
                .body("users[1].user", is("bob"))
                .body("users[1].pomodoroCount", is(0))
                .body("users[1].totalWorkMinutes", is(16))
                .body("users[1].firstSeen", is("2024-05-01T10:08:00Z"));

        var store = leaderboardManager.getLogStore();
        assertTrue(Files.exists(store.path(LeaderboardManager.LEADERBOARD_FILE)));
        assertTrue(Files.exists(store.path(LeaderboardManager.SESSION_LOG_FILE)));
        assertTrue(Files.exists(store.path(LeaderboardManager.REPORT_FILE)));
    }

    @Test
    @Order(5)
    @DisplayName("Session log should expose derived timers and windows")
    void testSessionLog() {
        given().contentType(ContentType.JSON).body(FIRST_SCRAPE).post("/ingest/scrape");
        given().contentType(ContentType.JSON).body(SECOND_SCRAPE).post("/ingest/scrape");
        given().post("/leaderboard/refresh");

        given()
            .when().get("/leaderboard/session-log")
            .then()
                .statusCode(200)
                .body("timerEventCount", is(1))
                .body("timerEvents[0].type", is("work"))
                .body("timerEvents[0].startTime", is("2024-05-01T09:59:00Z"))
                .body("timerEvents[0].endTime", is("2024-05-01T10:24:00Z"))
                .body("windows.alice[0].joinTime", is("2024-05-01T10:00:00Z"))
                .body("windows.bob[0].stillPresent", is(true));
    }

    @Test
    @Order(6)
    @DisplayName("Report endpoint should return the markdown table")
    void testReport() {
        given().contentType(ContentType.JSON).body(FIRST_SCRAPE).post("/ingest/scrape");
        given().post("/leaderboard/refresh");

        given()
            .when().get("/leaderboard/report")
            .then()
                .statusCode(200)
                .body(containsString("# Focus Room Leaderboard"))
                .body(containsString("| 1 | alice (online) |"));
    }
}
