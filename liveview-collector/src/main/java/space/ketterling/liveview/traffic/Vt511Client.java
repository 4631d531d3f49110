package space.ketterling.liveview.traffic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.liveview.http.MalformedResponseException;
import space.ketterling.liveview.http.UpstreamHttp;
import space.ketterling.liveview.util.Times;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for the New England Compass C2C XML portal (VT 511 incidents).
 *
 * <p>
 * The feed layout is not fixed, so incidents are located by element name
 * anywhere in the document and their fields by name anywhere inside each
 * incident.
 * </p>
 */
public class Vt511Client {
    private static final Logger log = LoggerFactory.getLogger(Vt511Client.class);

    public static final String SOURCE = "VT511";
    public static final String DEFAULT_BASE_URL = "https://nec-por.ne-compass.com/NEC.XmlDataPortal/api/c2c";
    public static final String ID_PREFIX = "vt511-";

    private final UpstreamHttp http;
    private final XmlMapper xml;
    private final String baseUrl;

    public Vt511Client(UpstreamHttp http, XmlMapper xml, String baseUrl) {
        this.http = http;
        this.xml = xml;
        this.baseUrl = baseUrl;
    }

    /**
     * Current incident snapshot for the Vermont network.
     */
    public List<TrafficIncident> currentIncidents() {
        String url = baseUrl + "?networks=Vermont&dataTypes=incidentData";
        return parse(http.get(SOURCE, url, "application/xml"));
    }

    List<TrafficIncident> parse(String body) {
        JsonNode root;
        try {
            root = xml.readTree(body);
        } catch (Exception e) {
            throw new MalformedResponseException(SOURCE, "unparseable XML", e);
        }

        List<JsonNode> nodes = new ArrayList<>();
        collectIncidents(root, nodes);

        List<TrafficIncident> out = new ArrayList<>();
        for (JsonNode n : nodes) {
            try {
                TrafficIncident inc = parseIncident(n);
                if (inc != null)
                    out.add(inc);
            } catch (RuntimeException e) {
                log.warn("Dropping malformed incident: {}", e.getMessage());
            }
        }
        return out;
    }

    private TrafficIncident parseIncident(JsonNode n) {
        String id = findText(n, "id");
        if (id == null) {
            log.debug("Skipping incident without id");
            return null;
        }

        double lat = microdegrees(findText(n, "lat"));
        double lon = microdegrees(findText(n, "lon"));
        if (lat == 0.0 && lon == 0.0)
            return null;

        String headline = findText(n, "headline");
        String description = findText(n, "description");
        String road = firstNonNull(findText(n, "roadName"), findText(n, "road"), findText(n, "routeDesignator"));

        return new TrafficIncident(
                ID_PREFIX + id,
                classify(n.toString()),
                severity(findText(n, "severity")),
                headline == null ? "Traffic Incident" : headline,
                description == null ? "" : description,
                lat,
                lon,
                road,
                findText(n, "affectedLanes"),
                null,
                Times.parseInstant(findText(n, "startTime")));
    }

    static String classify(String raw) {
        if (raw.contains("Construction") || raw.contains("RoadWork"))
            return "CONSTRUCTION";
        if (raw.contains("Accident"))
            return "ACCIDENT";
        if (raw.contains("BridgeOut") || raw.contains("Closure"))
            return "CLOSURE";
        return "HAZARD";
    }

    static String severity(String s) {
        if (s == null)
            return "MODERATE";
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> "MINOR";
            case "high" -> "MAJOR";
            default -> "MODERATE";
        };
    }

    private static double microdegrees(String s) {
        if (s == null)
            return 0.0;
        try {
            return Double.parseDouble(s) / 1_000_000.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    // -------------------------
    // tree helpers
    // -------------------------
    private static void collectIncidents(JsonNode node, List<JsonNode> out) {
        if (node.isArray()) {
            for (JsonNode child : node)
                collectIncidents(child, out);
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            var e = it.next();
            if ("incident".equalsIgnoreCase(e.getKey())) {
                if (e.getValue().isArray()) {
                    e.getValue().forEach(v -> {
                        if (v.isObject())
                            out.add(v);
                    });
                } else if (e.getValue().isObject()) {
                    out.add(e.getValue());
                }
            } else {
                collectIncidents(e.getValue(), out);
            }
        }
    }

    /**
     * Depth-first search for the first element named {@code tag} with text.
     */
    static String findText(JsonNode node, String tag) {
        if (node.isArray()) {
            for (JsonNode child : node) {
                String v = findText(child, tag);
                if (v != null)
                    return v;
            }
            return null;
        }
        JsonNode direct = null;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            var e = it.next();
            if (e.getKey().equalsIgnoreCase(tag)) {
                direct = e.getValue();
                break;
            }
        }
        String v = textOf(direct);
        if (v != null)
            return v;
        it = node.fields();
        while (it.hasNext()) {
            JsonNode child = it.next().getValue();
            if (child.isContainerNode()) {
                String found = findText(child, tag);
                if (found != null)
                    return found;
            }
        }
        return null;
    }

    private static String textOf(JsonNode v) {
        if (v == null || v.isNull())
            return null;
        if (v.isValueNode()) {
            String s = v.asText().trim();
            return s.isEmpty() ? null : s;
        }
        // element with attributes: text content sits under the empty key
        if (v.isObject() && v.has(""))
            return textOf(v.get(""));
        if (v.isArray() && !v.isEmpty())
            return textOf(v.get(0));
        return null;
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T v : values) {
            if (v != null)
                return v;
        }
        return null;
    }
}
