/*
* Copyright 2025 Taylor Ketterling
* API Server for VT LiveView, a weather, traffic and river data collection service.
* utalizes Javalin for HTTP server and exposes collector health, upstream metrics
* and cache administration. uses Jackson for JSON processing.
*/

package space.ketterling.liveview.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.liveview.cache.BoundedTtlCache;
import space.ketterling.liveview.config.AppConfig;
import space.ketterling.liveview.ingest.CollectorScheduler;
import space.ketterling.liveview.ingest.CollectorStatus;
import space.ketterling.liveview.metrics.UpstreamCallMetrics;
import space.ketterling.liveview.nws.NwsClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);
    static final String ADMIN_HEADER = "X-Admin-Token";

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final CollectorScheduler scheduler;
    private final UpstreamCallMetrics metrics;
    private final NwsClient nws;
    private final Clock clock;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, CollectorScheduler scheduler, UpstreamCallMetrics metrics,
            NwsClient nws, Clock clock) {
        this.cfg = cfg;
        this.om = om;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.nws = nws;
        this.clock = clock;
    }

    public void start() {
        start(cfg.apiPort());
    }

    /**
     * Starts on the given port (0 picks a free one) and returns the bound port.
     */
    public int start(int port) {
        log.info("Starting API server on port {}", port);
        app = Javalin.create(j -> j.http.defaultContentType = "application/json");

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.debug("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        // --------------------------------------------------------------------
        // Root + Health
        // --------------------------------------------------------------------
        app.get("/", ctx -> ctx.json(Map.of(
                "service", "vt-liveview-collector",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /api/metrics/upstream",
                        "POST /api/admin/cache/clear"
                })));

        app.get("/health", this::health);

        // --------------------------------------------------------------------
        // Upstream feed health (rolling window)
        // --------------------------------------------------------------------
        app.get("/api/metrics/upstream", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", metrics.windowMinutes());
            ArrayNode services = out.putArray("services");
            metrics.snapshot().forEach((name, snap) -> services.addObject()
                    .put("service", name)
                    .put("calls_last_hour", snap.calls())
                    .put("failures_last_hour", snap.failures())
                    .put("failure_pct", Math.round(snap.failurePct() * 10.0) / 10.0)
                    .put("status", snap.status()));
            ctx.json(out);
        });

        // --------------------------------------------------------------------
        // Admin
        // --------------------------------------------------------------------
        app.post("/api/admin/cache/clear", ctx -> {
            if (!authorized(ctx)) {
                ctx.status(401).json(om.createObjectNode().put("error", "unauthorized"));
                return;
            }
            nws.clearStationsCache();
            nws.clearZoneCache();
            log.info("Station and zone caches cleared by admin request");
            ctx.json(om.createObjectNode().put("cleared", true));
        });

        app.start(port);
        return app.port();
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------
    private void health(Context ctx) {
        CollectorScheduler.SchedulerStatus st = scheduler.status();
        ObjectNode out = om.createObjectNode();
        out.put("status", "ok");
        out.put("time", clock.instant().toString());
        out.put("enabled", st.enabled());
        out.put("running", scheduler.isRunning());

        ObjectNode collectors = out.putObject("collectors");
        for (Map.Entry<String, CollectorStatus> e : st.collectors().entrySet()) {
            CollectorStatus cs = e.getValue();
            ObjectNode row = collectors.putObject(e.getKey());
            putInstant(row, "lastRun", cs.lastRun());
            if (cs.lastResult() == null)
                row.putNull("lastResult");
            else
                row.put("lastResult", cs.lastResult());
            row.put("lastError", cs.lastError());
            putInstant(row, "nextRun", cs.nextRun());
        }

        ArrayNode caches = out.putArray("caches");
        for (BoundedTtlCache.Stats s : new BoundedTtlCache.Stats[] { nws.zoneCacheStats(), nws.gridCacheStats() }) {
            caches.addObject()
                    .put("name", s.name())
                    .put("size", s.size())
                    .put("maxSize", s.maxSize())
                    .put("ttlMs", s.ttlMs());
        }
        ctx.json(out);
    }

    private boolean authorized(Context ctx) {
        String expected = cfg.adminToken();
        if (expected == null || expected.isBlank())
            return true;
        String given = ctx.header(ADMIN_HEADER);
        if (given == null)
            return false;
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                given.getBytes(StandardCharsets.UTF_8));
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value == null)
            node.putNull(field);
        else
            node.put(field, value.toString());
    }
}
