/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for VT LiveView, a weather, traffic and river data collector.
*
* Initializes configuration, the database pool and schema, upstream clients, the alert
* merge engine and the historical collectors, then starts the collector scheduler and
* the health API. Startup flow wires every component once; program also handles a
* graceful shutdown.
*/

package space.ketterling.liveview;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.liveview.alerts.AlertMergeEngine;
import space.ketterling.liveview.api.ApiServer;
import space.ketterling.liveview.config.AppConfig;
import space.ketterling.liveview.db.*;
import space.ketterling.liveview.http.UpstreamHttp;
import space.ketterling.liveview.ingest.*;
import space.ketterling.liveview.ingest.CollectorScheduler.ScheduledCollector;
import space.ketterling.liveview.metrics.UpstreamCallMetrics;
import space.ketterling.liveview.nws.NwsClient;
import space.ketterling.liveview.traffic.Vt511Client;
import space.ketterling.liveview.usgs.UsgsClient;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        Clock clock = Clock.systemUTC();

        ObjectMapper om = new ObjectMapper();
        XmlMapper xml = new XmlMapper();
        HikariDataSource ingestDs = Database.createIngestDataSource(cfg);

        if (ingestDs == null) {
            log.warn("No JDBC URL configured; collectors will not persist anything");
        } else if (cfg.dbMigrate()) {
            SchemaMigrator.apply(ingestDs, SchemaMigrator.DEFAULT_SCRIPT);
        }

        // Repos (null when persistence is unconfigured)
        ObservationRepo observationRepo = ingestDs == null ? null : new ObservationRepo(ingestDs);
        AlertRepo alertRepo = ingestDs == null ? null : new AlertRepo(ingestDs, om);
        IncidentRepo incidentRepo = ingestDs == null ? null : new IncidentRepo(ingestDs, om);
        GaugeRepo gaugeRepo = ingestDs == null ? null : new GaugeRepo(ingestDs);

        // Upstream clients share one transport and one bounded fetch pool
        UpstreamCallMetrics metrics = new UpstreamCallMetrics(clock);
        UpstreamHttp http = new UpstreamHttp(cfg, metrics);
        AtomicInteger fetchThreads = new AtomicInteger();
        ExecutorService fetchExec = Executors.newFixedThreadPool(Math.max(1, cfg.fetchParallelism()), r -> {
            Thread t = new Thread(r, "upstream-fetch-" + fetchThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        NwsClient nws = new NwsClient(http, om, NwsClient.DEFAULT_BASE_URL, fetchExec, clock);
        UsgsClient usgs = new UsgsClient(http, om, UsgsClient.DEFAULT_BASE_URL, clock);
        Vt511Client vt511 = new Vt511Client(http, xml, Vt511Client.DEFAULT_BASE_URL);
        AlertMergeEngine mergeEngine = new AlertMergeEngine(nws, om, fetchExec);

        // Scheduler
        List<ScheduledCollector> table = List.of(
                new ScheduledCollector(new WeatherObservationCollector(nws, observationRepo, cfg.region()),
                        cfg.observations()),
                new ScheduledCollector(new WeatherAlertCollector(mergeEngine, alertRepo, cfg.region(), clock),
                        cfg.alerts()),
                new ScheduledCollector(new TrafficIncidentCollector(vt511, incidentRepo, clock), cfg.incidents()),
                new ScheduledCollector(new RiverGaugeCollector(usgs, gaugeRepo, cfg.region()), cfg.gauges()));
        CollectorScheduler scheduler = new CollectorScheduler(table,
                new RetryWrapper(cfg.retryMaxRetries(), cfg.retryBaseDelayMs()),
                cfg.collectorEnabled() && ingestDs != null,
                cfg.startupDelay(),
                clock);
        if (!scheduler.start()) {
            log.info("Collectors not scheduled (enabled={}, database={})",
                    cfg.collectorEnabled(), ingestDs != null);
        }

        // Expired grid point / zone entries are otherwise only dropped on read
        ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleWithFixedDelay(() -> {
            MDC.put("job", "cache-sweep");
            try {
                int dropped = nws.sweepCaches();
                if (dropped > 0)
                    log.debug("Swept {} expired cache entries", dropped);
            } catch (RuntimeException e) {
                log.error("Cache sweep failed", e);
            } finally {
                MDC.remove("job");
            }
        }, 10, 10, TimeUnit.MINUTES);

        ApiServer api = new ApiServer(cfg, om, scheduler, metrics, nws, clock);
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                scheduler.stop();
                sweeper.shutdownNow();
                fetchExec.shutdownNow();
                if (ingestDs != null)
                    ingestDs.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
