package space.ketterling.liveview.nws;

import java.time.Instant;

/**
 * Current conditions for a point, taken from the first nearby station that
 * reports a temperature.
 */
public record CurrentConditions(
        int temperatureF,
        String description,
        String windSpeed,
        String windDirection,
        Double humidity,
        Instant timestamp,
        String stationName,
        String icon) {
}
