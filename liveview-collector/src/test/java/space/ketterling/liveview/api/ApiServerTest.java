package space.ketterling.liveview.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import space.ketterling.liveview.cache.BoundedTtlCache;
import space.ketterling.liveview.config.AppConfig;
import space.ketterling.liveview.ingest.Collector;
import space.ketterling.liveview.ingest.CollectorScheduler;
import space.ketterling.liveview.ingest.CollectorScheduler.ScheduledCollector;
import space.ketterling.liveview.ingest.RetryWrapper;
import space.ketterling.liveview.metrics.UpstreamCallMetrics;
import space.ketterling.liveview.nws.NwsClient;
import space.ketterling.liveview.testutil.MutableClock;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApiServerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    @Mock
    private NwsClient nws;

    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private final MutableClock clock = new MutableClock(NOW);
    private UpstreamCallMetrics metrics;
    private CollectorScheduler scheduler;
    private ApiServer server;
    private String base;

    @BeforeEach
    void setUp() {
        Properties p = new Properties();
        p.setProperty("admin.token", "s3cret");
        AppConfig cfg = AppConfig.load(p);

        Collector weather = new Collector() {
            @Override
            public String name() {
                return "weather";
            }

            @Override
            public int collect() {
                return 7;
            }
        };
        scheduler = new CollectorScheduler(List.of(new ScheduledCollector(weather, Duration.ofMinutes(5))),
                new RetryWrapper(1, 1), true, Duration.ofSeconds(5), clock);
        metrics = new UpstreamCallMetrics(clock);

        server = new ApiServer(cfg, om, scheduler, metrics, nws, clock);
        base = "http://localhost:" + server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(base + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String token) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(base + path))
                .POST(HttpRequest.BodyPublishers.noBody());
        if (token != null)
            b.header(ApiServer.ADMIN_HEADER, token);
        return http.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_shouldReportCollectorStatus() throws Exception {
        when(nws.zoneCacheStats()).thenReturn(new BoundedTtlCache.Stats("zones", 3, 30, 86_400_000L));
        when(nws.gridCacheStats()).thenReturn(new BoundedTtlCache.Stats("gridpoints", 0, 100, 3_600_000L));
        scheduler.runNow("weather");

        HttpResponse<String> resp = get("/health");

        assertEquals(200, resp.statusCode());
        JsonNode body = om.readTree(resp.body());
        assertTrue(body.get("enabled").asBoolean());
        JsonNode weather = body.path("collectors").path("weather");
        assertEquals(NOW.toString(), weather.get("lastRun").asText());
        assertEquals(7, weather.get("lastResult").asInt());
        assertTrue(weather.get("lastError").isNull());
        assertEquals("zones", body.path("caches").get(0).get("name").asText());
        assertEquals(3, body.path("caches").get(0).get("size").asInt());
    }

    @Test
    void metrics_shouldListUpstreamSources() throws Exception {
        metrics.record("NWS", true);
        metrics.record("USGS", false);

        JsonNode body = om.readTree(get("/api/metrics/upstream").body());

        assertEquals(60, body.get("window_minutes").asInt());
        assertEquals("NWS", body.get("services").get(0).get("service").asText());
        assertEquals("ok", body.get("services").get(0).get("status").asText());
        assertEquals("down", body.get("services").get(1).get("status").asText());
    }

    @Test
    void root_shouldListEndpoints() throws Exception {
        JsonNode body = om.readTree(get("/").body());
        assertEquals("ok", body.get("status").asText());
        assertTrue(body.get("endpoints").isArray());
    }

    // -- Admin --

    @Test
    void cacheClear_shouldRequireToken() throws Exception {
        assertEquals(401, post("/api/admin/cache/clear", null).statusCode());
        assertEquals(401, post("/api/admin/cache/clear", "wrong").statusCode());
        verify(nws, never()).clearZoneCache();
    }

    @Test
    void cacheClear_shouldClearStationAndZoneCaches() throws Exception {
        HttpResponse<String> resp = post("/api/admin/cache/clear", "s3cret");

        assertEquals(200, resp.statusCode());
        verify(nws).clearStationsCache();
        verify(nws).clearZoneCache();
    }
}
