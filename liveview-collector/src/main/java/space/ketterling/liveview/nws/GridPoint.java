package space.ketterling.liveview.nws;

/**
 * Subset of {@code /points/{lat},{lon}} properties used for follow-up calls.
 */
public record GridPoint(
        String office,
        int gridX,
        int gridY,
        String forecastUrl,
        String forecastHourlyUrl,
        String observationStationsUrl) {
}
