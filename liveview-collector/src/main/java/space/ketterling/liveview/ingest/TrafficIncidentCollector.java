package space.ketterling.liveview.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.db.IncidentRepo;
import space.ketterling.liveview.traffic.TrafficIncident;
import space.ketterling.liveview.traffic.Vt511Client;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tracks VT 511 incidents through active -> resolved.
 *
 * <p>
 * Every incident in the snapshot is upserted; afterwards each still-active row
 * missing from the snapshot is resolved. Resolution is terminal.
 * </p>
 */
public class TrafficIncidentCollector implements Collector {
    private static final Logger log = LoggerFactory.getLogger(TrafficIncidentCollector.class);

    private final Vt511Client vt511;
    private final IncidentRepo repo; // nullable
    private final Clock clock;

    public TrafficIncidentCollector(Vt511Client vt511, IncidentRepo repo, Clock clock) {
        this.vt511 = vt511;
        this.repo = repo;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "traffic";
    }

    @Override
    public int collect() throws Exception {
        if (repo == null) {
            log.debug("Database not configured, skipping incidents");
            return 0;
        }

        List<TrafficIncident> incidents = vt511.currentIncidents();
        Instant now = clock.instant();

        Set<String> currentIds = new LinkedHashSet<>();
        for (TrafficIncident inc : incidents) {
            repo.upsertSeen(inc, now);
            currentIds.add(inc.sourceId());
        }
        int resolved = repo.resolveMissing(currentIds, now);

        log.info("Processed {} incidents, resolved {}", incidents.size(), resolved);
        return incidents.size();
    }
}
