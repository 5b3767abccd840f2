package org.focusroom.leaderboard;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.focusroom.leaderboard.ingest.LogStoreException;
import org.focusroom.leaderboard.ingest.ScrapeBatch;
import org.focusroom.leaderboard.ingest.ScrapeReceipt;
import org.focusroom.leaderboard.report.LeaderboardDocument;
import org.focusroom.leaderboard.report.SessionLogDocument;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestResponse;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import java.time.Clock;
import java.util.Map;

@Path("/")
@ApplicationScoped
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class);

    @Inject
    LeaderboardManager leaderboardManager;

    @Inject
    Clock clock;

    @GET
    @Path("/health")
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, String> health() {
        return Map.of(
            "status", "ok",
            "dataDir", leaderboardManager.getLogStore().getDataDir().toString(),
            "timestamp", clock.instant().toString()
        );
    }

    @GET
    @Path("/leaderboard")
    @Produces(MediaType.APPLICATION_JSON)
    public LeaderboardDocument leaderboard() {
        return leaderboardManager.getLeaderboard();
    }

    @POST
    @Path("/leaderboard/refresh")
    @Produces(MediaType.APPLICATION_JSON)
    public LeaderboardDocument refresh() {
        return leaderboardManager.refresh();
    }

    @GET
    @Path("/leaderboard/session-log")
    @Produces(MediaType.APPLICATION_JSON)
    public SessionLogDocument sessionLog() {
        return leaderboardManager.getSessionLog();
    }

    @GET
    @Path("/leaderboard/report")
    @Produces(MediaType.TEXT_PLAIN)
    public String report() {
        return leaderboardManager.renderReport();
    }

    @POST
    @Path("/ingest/scrape")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public ScrapeReceipt ingestScrape(ScrapeBatch batch) {
        if (batch == null) {
            batch = new ScrapeBatch();
        }
        return leaderboardManager.recordScrape(batch);
    }

    @ServerExceptionMapper
    public RestResponse<Map<String, String>> mapLogStoreFailure(LogStoreException e) {
        LOG.error("Log store failure: " + e.getMessage(), e);
        return RestResponse.status(Response.Status.INTERNAL_SERVER_ERROR,
            Map.of("status", "error", "message", e.getMessage()));
    }
}
