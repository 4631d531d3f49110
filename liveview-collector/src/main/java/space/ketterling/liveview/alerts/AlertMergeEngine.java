package space.ketterling.liveview.alerts;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.nws.NwsClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Collapses the active alerts of a state into one alert per event type.
 *
 * <p>
 * A group survives only if it references at least one zone of the region.
 * Inline alert polygons win over zone outlines: zones are fetched only when no
 * member carries its own geometry. A zone that fails to load is left out of
 * the group's geometry; the group itself still completes.
 * </p>
 */
public class AlertMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(AlertMergeEngine.class);

    /**
     * Highest severity, then certainty, then urgency first. Earliest effective
     * and then id keep the order stable for equal ranks.
     */
    static final Comparator<RawAlert> PRIORITY = Comparator
            .comparingInt((RawAlert a) -> Severity.of(a.severity()).rank()).reversed()
            .thenComparing(Comparator.comparingInt((RawAlert a) -> Certainty.of(a.certainty()).rank()).reversed())
            .thenComparing(Comparator.comparingInt((RawAlert a) -> Urgency.of(a.urgency()).rank()).reversed())
            .thenComparing(RawAlert::effective, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(RawAlert::id);

    private final NwsClient nws;
    private final ObjectMapper om;
    private final ExecutorService fetchExec;

    public AlertMergeEngine(NwsClient nws, ObjectMapper om, ExecutorService fetchExec) {
        this.nws = nws;
        this.om = om;
        this.fetchExec = fetchExec;
    }

    /**
     * Fetches active alerts for the region and merges them. A failure of the
     * alert fetch itself propagates.
     */
    public List<MergedAlert> mergedAlerts(String region) {
        List<RawAlert> raw = nws.activeAlerts(region);
        List<MergedAlert> merged = merge(raw, region);
        log.info("Merged {} active alerts into {} for {}", raw.size(), merged.size(), region);
        return merged;
    }

    /**
     * Groups by event type and merges each group.
     */
    public List<MergedAlert> merge(List<RawAlert> alerts, String region) {
        Map<String, List<RawAlert>> byEvent = new LinkedHashMap<>();
        for (RawAlert a : alerts) {
            byEvent.computeIfAbsent(a.event(), k -> new ArrayList<>()).add(a);
        }

        List<MergedAlert> out = new ArrayList<>();
        for (var e : byEvent.entrySet()) {
            MergedAlert m = mergeGroup(e.getKey(), e.getValue(), region);
            if (m != null)
                out.add(m);
        }
        return out;
    }

    private MergedAlert mergeGroup(String event, List<RawAlert> members, String region) {
        Set<String> regionZones = new LinkedHashSet<>();
        for (RawAlert a : members) {
            for (String z : a.affectedZones()) {
                if (Zones.isRegionZone(z, region))
                    regionZones.add(Zones.extractZoneId(z));
            }
        }
        if (regionZones.isEmpty()) {
            log.debug("Skipping '{}' ({} alerts): no {} zones affected", event, members.size(), region);
            return null;
        }

        List<JsonNode> polygons = new ArrayList<>();
        List<String> zoneNames = new ArrayList<>();
        boolean anyInline = members.stream().anyMatch(RawAlert::hasGeometry);
        if (anyInline) {
            for (RawAlert a : members) {
                if (a.hasGeometry())
                    polygons.add(a.geometry());
            }
        } else {
            for (ZoneBoundary zb : fetchZones(regionZones)) {
                polygons.add(zb.geometry());
                if (zb.name() != null)
                    zoneNames.add(zb.name());
            }
        }

        RawAlert primary = members.stream().sorted(PRIORITY).findFirst().orElseThrow();

        Instant effective = members.stream().map(RawAlert::effective)
                .min(Comparator.naturalOrder()).orElse(null);
        Instant expires = members.stream().map(RawAlert::expires)
                .max(Comparator.naturalOrder()).orElse(null);

        String areaDesc = zoneNames.isEmpty() ? primary.areaDesc() : String.join("; ", zoneNames);

        return new MergedAlert(
                primary.id(),
                event,
                primary.severity(),
                primary.certainty(),
                primary.urgency(),
                primary.headline(),
                primary.description(),
                primary.instruction(),
                areaDesc,
                concatPolygons(polygons),
                effective,
                expires,
                members.stream().map(RawAlert::id).collect(Collectors.toList()),
                regionZones);
    }

    /**
     * Loads zone outlines in parallel; failed or empty zones are skipped.
     */
    private List<ZoneBoundary> fetchZones(Set<String> zoneIds) {
        Map<String, CompletableFuture<ZoneBoundary>> pending = new LinkedHashMap<>();
        for (String zoneId : zoneIds) {
            pending.put(zoneId, CompletableFuture.supplyAsync(() -> {
                try {
                    return nws.zoneBoundary(zoneId);
                } catch (Exception ex) {
                    throw new CompletionException(ex);
                }
            }, fetchExec));
        }

        List<ZoneBoundary> out = new ArrayList<>();
        for (var e : pending.entrySet()) {
            try {
                ZoneBoundary zb = e.getValue().join();
                if (zb != null)
                    out.add(zb);
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                log.warn("Zone {} lookup failed, omitting from geometry: {}", e.getKey(), cause.getMessage());
            }
        }
        return out;
    }

    /**
     * Concatenates Polygon/MultiPolygon geometries into one MultiPolygon. This
     * is not a geometric union; overlapping outlines stay overlapping.
     */
    JsonNode concatPolygons(List<JsonNode> geometries) {
        if (geometries.isEmpty())
            return null;
        ObjectNode multi = om.createObjectNode();
        multi.put("type", "MultiPolygon");
        ArrayNode coords = multi.putArray("coordinates");
        for (JsonNode g : geometries) {
            String type = g.path("type").asText("");
            if ("Polygon".equals(type)) {
                coords.add(g.get("coordinates").deepCopy());
            } else if ("MultiPolygon".equals(type)) {
                for (JsonNode poly : g.get("coordinates"))
                    coords.add(poly.deepCopy());
            }
        }
        return coords.isEmpty() ? null : multi;
    }
}
