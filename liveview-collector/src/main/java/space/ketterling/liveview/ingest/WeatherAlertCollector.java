package space.ketterling.liveview.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.alerts.AlertMergeEngine;
import space.ketterling.liveview.alerts.MergedAlert;
import space.ketterling.liveview.db.AlertRepo;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Records merged region alerts, tracking when each was first and last seen.
 */
public class WeatherAlertCollector implements Collector {
    private static final Logger log = LoggerFactory.getLogger(WeatherAlertCollector.class);

    private final AlertMergeEngine engine;
    private final AlertRepo repo; // nullable
    private final String region;
    private final Clock clock;

    public WeatherAlertCollector(AlertMergeEngine engine, AlertRepo repo, String region, Clock clock) {
        this.engine = engine;
        this.repo = repo;
        this.region = region;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "alerts";
    }

    @Override
    public int collect() throws Exception {
        if (repo == null) {
            log.debug("Database not configured, skipping alerts");
            return 0;
        }

        List<MergedAlert> alerts = engine.mergedAlerts(region);
        if (alerts.isEmpty()) {
            log.info("No active alerts for {}", region);
            return 0;
        }

        Instant now = clock.instant();
        int processed = 0;
        for (MergedAlert a : alerts) {
            repo.upsertSeen(a, now);
            processed++;
        }
        log.info("Processed {} alerts", processed);
        return processed;
    }
}
