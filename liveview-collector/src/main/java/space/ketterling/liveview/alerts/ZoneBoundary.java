package space.ketterling.liveview.alerts;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Forecast zone outline from {@code /zones/forecast/{id}}.
 */
public record ZoneBoundary(String id, String name, String state, JsonNode geometry) {
}
