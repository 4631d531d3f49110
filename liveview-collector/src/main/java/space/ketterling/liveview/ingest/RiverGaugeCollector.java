package space.ketterling.liveview.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.db.GaugeRepo;
import space.ketterling.liveview.usgs.GaugeReading;
import space.ketterling.liveview.usgs.UsgsClient;

import java.util.List;

/**
 * Stores the latest USGS gage height of every active site in the region.
 */
public class RiverGaugeCollector implements Collector {
    private static final Logger log = LoggerFactory.getLogger(RiverGaugeCollector.class);

    private final UsgsClient usgs;
    private final GaugeRepo repo; // nullable
    private final String region;

    public RiverGaugeCollector(UsgsClient usgs, GaugeRepo repo, String region) {
        this.usgs = usgs;
        this.repo = repo;
        this.region = region;
    }

    @Override
    public String name() {
        return "gauges";
    }

    @Override
    public int collect() throws Exception {
        if (repo == null) {
            log.debug("Database not configured, skipping gauges");
            return 0;
        }

        List<GaugeReading> readings = usgs.latestGageHeights(region);
        if (readings.isEmpty()) {
            log.info("No gauge data from USGS for {}", region);
            return 0;
        }

        int inserted = repo.insertIgnoringDuplicates(readings);
        log.info("Stored {} gauge readings ({} new)", readings.size(), inserted);
        return readings.size();
    }
}
