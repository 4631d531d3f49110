package space.ketterling.liveview.usgs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.http.MalformedResponseException;
import space.ketterling.liveview.http.UpstreamHttp;
import space.ketterling.liveview.util.Times;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for USGS Water Services instantaneous values (gage height, feet).
 */
public class UsgsClient {
    private static final Logger log = LoggerFactory.getLogger(UsgsClient.class);

    public static final String SOURCE = "USGS";
    public static final String DEFAULT_BASE_URL = "https://waterservices.usgs.gov/nwis/iv";

    // parameterCd 00065 = gage height (ft)
    private static final String GAGE_HEIGHT = "00065";
    static final Duration MAX_READING_AGE = Duration.ofHours(3);

    private final UpstreamHttp http;
    private final ObjectMapper om;
    private final String baseUrl;
    private final Clock clock;

    public UsgsClient(UpstreamHttp http, ObjectMapper om, String baseUrl, Clock clock) {
        this.http = http;
        this.om = om;
        this.baseUrl = baseUrl;
        this.clock = clock;
    }

    /**
     * Latest reading of every active gage in the state. Sites without location,
     * value or a reading from the last three hours are dropped.
     */
    public List<GaugeReading> latestGageHeights(String state) {
        String url = baseUrl + "?format=json&stateCd=" + state + "&parameterCd=" + GAGE_HEIGHT
                + "&siteStatus=active";
        String body = http.get(SOURCE, url, "application/json");
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (Exception e) {
            throw new MalformedResponseException(SOURCE, "unparseable JSON from " + url, e);
        }
        return parse(root);
    }

    List<GaugeReading> parse(JsonNode root) {
        JsonNode series = root.path("value").path("timeSeries");
        if (!series.isArray())
            throw new MalformedResponseException(SOURCE, "No value.timeSeries array");

        Instant cutoff = clock.instant().minus(MAX_READING_AGE);
        List<GaugeReading> out = new ArrayList<>();
        int dropped = 0;
        for (JsonNode ts : series) {
            GaugeReading r = parseSeries(ts, cutoff);
            if (r == null)
                dropped++;
            else
                out.add(r);
        }
        log.debug("USGS parsed {} readings, dropped {}", out.size(), dropped);
        return out;
    }

    private GaugeReading parseSeries(JsonNode ts, Instant cutoff) {
        JsonNode info = ts.path("sourceInfo");
        String siteCode = info.path("siteCode").path(0).path("value").asText(null);
        JsonNode geo = info.path("geoLocation").path("geogLocation");
        if (siteCode == null || siteCode.isBlank() || geo.isMissingNode())
            return null;

        double lat = geo.path("latitude").asDouble(0.0);
        double lon = geo.path("longitude").asDouble(0.0);
        if (lat == 0.0 && lon == 0.0)
            return null;

        JsonNode values = ts.path("values").path(0).path("value");
        if (!values.isArray() || values.isEmpty())
            return null;
        JsonNode latest = values.get(values.size() - 1);

        BigDecimal height;
        try {
            height = new BigDecimal(latest.path("value").asText(""));
        } catch (NumberFormatException e) {
            return null;
        }
        Instant observedAt = Times.parseInstant(latest.path("dateTime").asText(null));
        if (observedAt == null || observedAt.isBefore(cutoff))
            return null;

        String siteName = info.path("siteName").asText("Unknown");
        return new GaugeReading(siteCode, siteName, lat, lon, height, observedAt);
    }
}
