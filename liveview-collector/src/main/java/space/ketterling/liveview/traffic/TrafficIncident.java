package space.ketterling.liveview.traffic;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One incident from the VT 511 feed. {@code sourceId} is the natural key
 * ("vt511-" + feed id).
 */
public record TrafficIncident(
        String sourceId,
        String type,
        String severity,
        String title,
        String description,
        double latitude,
        double longitude,
        String roadName,
        String affectedLanes,
        JsonNode geometry,
        Instant startedAt) {
}
