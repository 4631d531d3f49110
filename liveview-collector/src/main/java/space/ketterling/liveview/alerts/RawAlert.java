package space.ketterling.liveview.alerts;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * One active alert as published by weather.gov.
 *
 * @param affectedZones zone URLs (or bare ids) listed by the alert
 * @param geometry      inline Polygon/MultiPolygon, or null when the alert
 *                      only references zones
 */
public record RawAlert(
        String id,
        String event,
        String severity,
        String certainty,
        String urgency,
        String headline,
        String description,
        String instruction,
        String areaDesc,
        List<String> affectedZones,
        JsonNode geometry,
        Instant effective,
        Instant expires) {

    public RawAlert {
        affectedZones = affectedZones == null ? List.of() : List.copyOf(affectedZones);
    }

    public boolean hasGeometry() {
        return geometry != null && !geometry.isNull();
    }
}
