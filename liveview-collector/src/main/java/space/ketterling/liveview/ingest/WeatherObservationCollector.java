package space.ketterling.liveview.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.db.ObservationRepo;
import space.ketterling.liveview.db.ObservationRepo.ObservationRow;
import space.ketterling.liveview.nws.NwsClient;
import space.ketterling.liveview.nws.ObservationStation;
import space.ketterling.liveview.nws.StationWeather;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stores the latest observation of every region station.
 */
public class WeatherObservationCollector implements Collector {
    private static final Logger log = LoggerFactory.getLogger(WeatherObservationCollector.class);
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private final NwsClient nws;
    private final ObservationRepo repo; // nullable
    private final String region;

    public WeatherObservationCollector(NwsClient nws, ObservationRepo repo, String region) {
        this.nws = nws;
        this.repo = repo;
        this.region = region;
    }

    @Override
    public String name() {
        return "weather";
    }

    @Override
    public int collect() throws Exception {
        if (repo == null) {
            log.debug("Database not configured, skipping observations");
            return 0;
        }

        List<ObservationStation> stations = nws.observationStations(region);
        if (stations.isEmpty()) {
            log.info("No stations returned for {}", region);
            return 0;
        }

        List<ObservationRow> rows = new ArrayList<>();
        for (ObservationStation s : stations) {
            StationWeather w = s.weather();
            if (w == null || w.timestamp() == null)
                continue;
            rows.add(new ObservationRow(
                    s.id(),
                    s.name() == null ? s.id() : s.name(),
                    scaled(s.lat(), 6),
                    scaled(s.lon(), 6),
                    w.timestamp(),
                    w.temperatureF() == null ? null : BigDecimal.valueOf(w.temperatureF()).setScale(1),
                    w.humidity() == null ? null : scaled(w.humidity(), 2),
                    parseWindSpeed(w.windSpeed()),
                    w.windDirection(),
                    w.pressureMb(),
                    truncate(w.description(), 255)));
        }

        if (rows.isEmpty()) {
            log.info("No valid observations to store");
            return 0;
        }

        int inserted = repo.insertIgnoringDuplicates(rows);
        log.info("Stored {} observations ({} new)", rows.size(), inserted);
        return rows.size();
    }

    /**
     * "12 mph" -> 12.0; null when no number is present.
     */
    static BigDecimal parseWindSpeed(String text) {
        if (text == null)
            return null;
        Matcher m = NUMBER.matcher(text);
        return m.find() ? new BigDecimal(m.group(1)).setScale(1, RoundingMode.HALF_UP) : null;
    }

    private static BigDecimal scaled(double v, int scale) {
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP);
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
