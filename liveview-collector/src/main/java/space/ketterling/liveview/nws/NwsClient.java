package space.ketterling.liveview.nws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.alerts.RawAlert;
import space.ketterling.liveview.alerts.ZoneBoundary;
import space.ketterling.liveview.cache.BoundedTtlCache;
import space.ketterling.liveview.cache.SnapshotCache;
import space.ketterling.liveview.http.MalformedResponseException;
import space.ketterling.liveview.http.UpstreamHttp;
import space.ketterling.liveview.util.Times;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * HTTP client for National Weather Service (api.weather.gov) endpoints.
 *
 * <p>
 * Owns the three lookup caches: grid points (1h, 100 entries), forecast zone
 * boundaries (24h, 30 entries) and the region station directory (15 min,
 * refreshed as a whole).
 * </p>
 */
public class NwsClient {
    private static final Logger log = LoggerFactory.getLogger(NwsClient.class);

    public static final String SOURCE = "NWS";
    public static final String DEFAULT_BASE_URL = "https://api.weather.gov";

    static final int GRID_CACHE_MAX = 100;
    static final Duration GRID_CACHE_TTL = Duration.ofHours(1);
    static final int ZONE_CACHE_MAX = 30;
    static final Duration ZONE_CACHE_TTL = Duration.ofHours(24);
    static final Duration STATIONS_TTL = Duration.ofMinutes(15);
    static final int STATION_LIMIT = 50;
    private static final int NEARBY_STATION_TRIES = 3;
    private static final String GEO_JSON = "application/geo+json";

    private final UpstreamHttp http;
    private final ObjectMapper om;
    private final String baseUrl;
    private final ExecutorService fetchExec;

    private final BoundedTtlCache<String, GridPoint> gridCache;
    private final BoundedTtlCache<String, ZoneBoundary> zoneCache;
    private final SnapshotCache<RegionStations> stationCache;

    /**
     * Creates a new NWS client; {@code fetchExec} runs parallel per-station calls.
     */
    public NwsClient(UpstreamHttp http, ObjectMapper om, String baseUrl, ExecutorService fetchExec, Clock clock) {
        this.http = http;
        this.om = om;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.fetchExec = fetchExec;
        this.gridCache = new BoundedTtlCache<>("gridpoints", GRID_CACHE_MAX, GRID_CACHE_TTL, clock);
        this.zoneCache = new BoundedTtlCache<>("zones", ZONE_CACHE_MAX, ZONE_CACHE_TTL, clock);
        this.stationCache = new SnapshotCache<>(STATIONS_TTL, clock);
    }

    /**
     * Performs a GET request and parses JSON.
     */
    JsonNode getJson(String url) {
        String body = http.get(SOURCE, url, GEO_JSON);
        try {
            return om.readTree(body);
        } catch (Exception e) {
            throw new MalformedResponseException(SOURCE, "unparseable JSON from " + url, e);
        }
    }

    // -------------------------
    // Alerts + zones
    // -------------------------
    /**
     * Fetches active alerts for a state. Features missing an id, event or
     * effective/expires time are dropped.
     */
    public List<RawAlert> activeAlerts(String area) {
        String url = baseUrl + "/alerts/active?area=" + area;
        JsonNode features = getJson(url).path("features");
        if (!features.isArray())
            throw new MalformedResponseException(SOURCE, "No features array in " + url);

        List<RawAlert> out = new ArrayList<>();
        for (JsonNode feat : features) {
            try {
                RawAlert alert = parseAlert(feat);
                if (alert != null)
                    out.add(alert);
            } catch (RuntimeException e) {
                log.warn("Dropping malformed alert feature {}: {}", feat.path("id").asText("?"), e.getMessage());
            }
        }
        return out;
    }

    private RawAlert parseAlert(JsonNode feat) {
        JsonNode props = feat.path("properties");
        String id = text(props, "id");
        if (id == null)
            id = text(feat, "id");
        String event = text(props, "event");
        Instant effective = Times.parseInstant(text(props, "effective"));
        Instant expires = Times.parseInstant(text(props, "expires"));
        if (id == null || event == null || effective == null || expires == null) {
            log.debug("Skipping alert feature without id/event/times: {}", id);
            return null;
        }

        List<String> zones = new ArrayList<>();
        for (JsonNode z : props.path("affectedZones")) {
            if (z.isTextual())
                zones.add(z.asText());
        }

        return new RawAlert(
                id,
                event,
                text(props, "severity"),
                text(props, "certainty"),
                text(props, "urgency"),
                text(props, "headline"),
                text(props, "description"),
                text(props, "instruction"),
                text(props, "areaDesc"),
                zones,
                polygonal(feat.get("geometry")),
                effective,
                expires);
    }

    /**
     * Returns a zone's outline through the zone cache, or null when the zone
     * has no geometry. Upstream failures propagate.
     */
    public ZoneBoundary zoneBoundary(String zoneId) throws Exception {
        return zoneCache.getOrFetch(zoneId, this::fetchZoneBoundary);
    }

    private ZoneBoundary fetchZoneBoundary(String zoneId) {
        JsonNode root = getJson(baseUrl + "/zones/forecast/" + zoneId);
        JsonNode geometry = polygonal(root.get("geometry"));
        if (geometry == null) {
            log.warn("Zone {} has no geometry", zoneId);
            return null;
        }
        JsonNode props = root.path("properties");
        String id = text(props, "id");
        return new ZoneBoundary(id == null ? zoneId : id, text(props, "name"), text(props, "state"), geometry);
    }

    // -------------------------
    // Grid points / point lookups
    // -------------------------
    /**
     * Resolves the NWS grid point for coordinates; cached per 4-decimal key.
     */
    public GridPoint gridPoint(double lat, double lon) throws Exception {
        String key = String.format(Locale.ROOT, "%.4f,%.4f", lat, lon);
        return gridCache.getOrFetch(key, k -> fetchGridPoint(lat, lon));
    }

    private GridPoint fetchGridPoint(double lat, double lon) {
        String url = baseUrl + "/points/" + lat + "," + lon;
        JsonNode props = getJson(url).path("properties");
        String office = text(props, "gridId");
        String forecast = text(props, "forecast");
        if (office == null || forecast == null)
            throw new MalformedResponseException(SOURCE, "Missing grid point fields for " + lat + "," + lon);
        return new GridPoint(
                office,
                props.path("gridX").asInt(),
                props.path("gridY").asInt(),
                forecast,
                text(props, "forecastHourly"),
                text(props, "observationStations"));
    }

    /**
     * Current conditions from the first of the nearest stations that reports a
     * temperature.
     */
    public CurrentConditions currentConditions(double lat, double lon) throws Exception {
        GridPoint gp = gridPoint(lat, lon);
        if (gp.observationStationsUrl() == null)
            throw new MalformedResponseException(SOURCE, "Grid point has no observationStations link");

        JsonNode stations = getJson(gp.observationStationsUrl()).path("features");
        if (!stations.isArray() || stations.isEmpty())
            throw new MalformedResponseException(SOURCE, "No observation stations found");

        int tried = 0;
        for (JsonNode station : stations) {
            if (tried++ >= NEARBY_STATION_TRIES)
                break;
            String stationId = text(station.path("properties"), "stationIdentifier");
            if (stationId == null)
                continue;
            try {
                JsonNode props = getJson(baseUrl + "/stations/" + stationId + "/observations/latest")
                        .path("properties");
                StationWeather w = parseObservation(props);
                if (w == null)
                    continue;
                return new CurrentConditions(
                        w.temperatureF(),
                        w.description(),
                        w.windSpeed(),
                        w.windDirection(),
                        w.humidity(),
                        w.timestamp(),
                        text(station.path("properties"), "name"),
                        text(props, "icon"));
            } catch (RuntimeException e) {
                log.debug("Station {} observation unavailable: {}", stationId, e.getMessage());
            }
        }
        throw new MalformedResponseException(SOURCE, "No valid observations available from nearby stations");
    }

    /**
     * Forecast periods for a point.
     */
    public List<ForecastPeriod> forecast(double lat, double lon) throws Exception {
        GridPoint gp = gridPoint(lat, lon);
        JsonNode periods = getJson(gp.forecastUrl()).path("properties").path("periods");
        if (!periods.isArray())
            throw new MalformedResponseException(SOURCE, "No periods array");

        List<ForecastPeriod> out = new ArrayList<>();
        for (JsonNode p : periods) {
            out.add(new ForecastPeriod(
                    text(p, "name"),
                    p.hasNonNull("temperature") ? p.get("temperature").asInt() : null,
                    text(p, "temperatureUnit"),
                    text(p, "shortForecast"),
                    text(p, "detailedForecast"),
                    Times.parseInstant(text(p, "startTime")),
                    Times.parseInstant(text(p, "endTime")),
                    p.path("isDaytime").asBoolean(false),
                    text(p, "windSpeed"),
                    text(p, "windDirection")));
        }
        return out;
    }

    // -------------------------
    // Station directory
    // -------------------------
    /**
     * All stations of a state that currently report a temperature, with their
     * latest observation. The whole list is cached for 15 minutes.
     */
    public List<ObservationStation> observationStations(String state) throws Exception {
        RegionStations cached = stationCache.get(() -> new RegionStations(state, fetchStations(state)));
        if (!cached.state().equals(state)) {
            stationCache.clear();
            cached = stationCache.get(() -> new RegionStations(state, fetchStations(state)));
        }
        return cached.stations();
    }

    private List<ObservationStation> fetchStations(String state) {
        String url = baseUrl + "/stations?state=" + state + "&limit=" + STATION_LIMIT;
        JsonNode features = getJson(url).path("features");
        if (!features.isArray())
            throw new MalformedResponseException(SOURCE, "No features array in " + url);

        List<CompletableFuture<ObservationStation>> pending = new ArrayList<>();
        int n = 0;
        for (JsonNode station : features) {
            if (n++ >= STATION_LIMIT)
                break;
            pending.add(CompletableFuture.supplyAsync(() -> stationWithWeather(station), fetchExec));
        }

        List<ObservationStation> out = new ArrayList<>();
        for (CompletableFuture<ObservationStation> f : pending) {
            ObservationStation s = f.join();
            if (s != null)
                out.add(s);
        }
        log.info("Station directory refreshed for {}: {} of {} stations reporting", state, out.size(),
                pending.size());
        return out;
    }

    private ObservationStation stationWithWeather(JsonNode station) {
        JsonNode sp = station.path("properties");
        String stationId = text(sp, "stationIdentifier");
        JsonNode coords = station.path("geometry").path("coordinates");
        if (stationId == null || !coords.isArray() || coords.size() < 2)
            return null;
        try {
            JsonNode props = getJson(baseUrl + "/stations/" + stationId + "/observations/latest")
                    .path("properties");
            StationWeather weather = parseObservation(props);
            if (weather == null)
                return null;
            JsonNode elev = sp.path("elevation").path("value");
            Integer elevationFt = elev.isNumber() && elev.asDouble() != 0.0
                    ? WeatherUnits.metersToFeet(elev.asDouble())
                    : null;
            return new ObservationStation(
                    stationId,
                    text(sp, "name"),
                    coords.get(1).asDouble(),
                    coords.get(0).asDouble(),
                    elevationFt,
                    weather);
        } catch (RuntimeException e) {
            log.debug("Skipping station {}: {}", stationId, e.getMessage());
            return null;
        }
    }

    /**
     * Converts an observation's SI values; null when there is no temperature.
     */
    private StationWeather parseObservation(JsonNode props) {
        Double tempC = value(props.path("temperature"));
        if (tempC == null)
            return null;
        Double windMps = value(props.path("windSpeed"));
        Double windDeg = value(props.path("windDirection"));
        Double dewC = value(props.path("dewpoint"));
        Double pressurePa = value(props.path("barometricPressure"));
        Instant ts = Times.parseInstant(text(props, "timestamp"));

        String description = text(props, "textDescription");
        return new StationWeather(
                WeatherUnits.celsiusToFahrenheit(tempC),
                description == null ? "Unknown" : description,
                windMps == null ? null : WeatherUnits.metersPerSecondToMphText(windMps),
                windDeg == null ? null : WeatherUnits.degreesToCardinal(windDeg),
                value(props.path("relativeHumidity")),
                dewC == null ? null : WeatherUnits.celsiusToFahrenheit(dewC),
                pressurePa == null ? null : WeatherUnits.pascalsToMillibars(pressurePa),
                ts);
    }

    // -------------------------
    // Cache admin
    // -------------------------
    public void clearStationsCache() {
        stationCache.clear();
    }

    public void clearZoneCache() {
        zoneCache.clear();
    }

    public BoundedTtlCache.Stats zoneCacheStats() {
        return zoneCache.stats();
    }

    public BoundedTtlCache.Stats gridCacheStats() {
        return gridCache.stats();
    }

    /**
     * Drops expired grid point and zone entries.
     */
    public int sweepCaches() {
        return gridCache.sweepExpired() + zoneCache.sweepExpired();
    }

    // -------------------------
    // Helpers
    // -------------------------
    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull())
            return null;
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    private static Double value(JsonNode quantity) {
        JsonNode v = quantity.get("value");
        if (v == null || !v.isNumber())
            return null;
        return v.asDouble();
    }

    /**
     * Keeps only Polygon and MultiPolygon geometries.
     */
    private static JsonNode polygonal(JsonNode geometry) {
        if (geometry == null || geometry.isNull())
            return null;
        String type = geometry.path("type").asText("");
        if (!"Polygon".equals(type) && !"MultiPolygon".equals(type))
            return null;
        if (!geometry.path("coordinates").isArray())
            return null;
        return geometry;
    }

    private record RegionStations(String state, List<ObservationStation> stations) {
    }
}
