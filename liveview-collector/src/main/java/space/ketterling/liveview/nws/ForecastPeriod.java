package space.ketterling.liveview.nws;

import java.time.Instant;

public record ForecastPeriod(
        String name,
        Integer temperature,
        String temperatureUnit,
        String shortForecast,
        String detailedForecast,
        Instant startTime,
        Instant endTime,
        boolean daytime,
        String windSpeed,
        String windDirection) {
}
