package space.ketterling.liveview.nws;

import java.time.Instant;

/**
 * Latest observation of a station, converted to the units the feeds are
 * stored in (°F, mph, mb).
 */
public record StationWeather(
        Integer temperatureF,
        String description,
        String windSpeed,
        String windDirection,
        Double humidity,
        Integer dewpointF,
        Integer pressureMb,
        Instant timestamp) {
}
