package space.ketterling.liveview.alerts;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * One synthetic alert standing for every active alert of the same event type
 * that touches the target region.
 *
 * <p>
 * Text and CAP fields come from the highest ranked member. {@code geometry} is
 * a MultiPolygon concatenating the member (or zone) polygons, or null.
 * </p>
 */
public record MergedAlert(
        String id,
        String event,
        String severity,
        String certainty,
        String urgency,
        String headline,
        String description,
        String instruction,
        String areaDesc,
        JsonNode geometry,
        Instant effective,
        Instant expires,
        List<String> mergedFrom,
        Set<String> affectedZoneIds) {

    public MergedAlert {
        mergedFrom = List.copyOf(mergedFrom);
        affectedZoneIds = Collections.unmodifiableSortedSet(new TreeSet<>(affectedZoneIds));
    }
}
