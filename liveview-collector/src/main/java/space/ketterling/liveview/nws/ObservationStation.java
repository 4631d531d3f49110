package space.ketterling.liveview.nws;

/**
 * A region station together with its latest valid observation.
 */
public record ObservationStation(
        String id,
        String name,
        double lat,
        double lon,
        Integer elevationFt,
        StationWeather weather) {
}
