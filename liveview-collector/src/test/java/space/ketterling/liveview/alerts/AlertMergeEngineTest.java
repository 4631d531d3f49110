package space.ketterling.liveview.alerts;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import space.ketterling.liveview.http.UpstreamUnavailableException;
import space.ketterling.liveview.nws.NwsClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertMergeEngineTest {

    private static final String ZONE_URL = "https://api.weather.gov/zones/forecast/";
    private static final Instant T0 = Instant.parse("2026-01-10T06:00:00Z");

    @Mock
    private NwsClient nws;

    private final ObjectMapper om = new ObjectMapper();
    private ExecutorService exec;
    private AlertMergeEngine engine;

    @BeforeEach
    void setUp() {
        exec = Executors.newFixedThreadPool(4);
        engine = new AlertMergeEngine(nws, om, exec);
    }

    @AfterEach
    void tearDown() {
        exec.shutdownNow();
    }

    private JsonNode square(double lon, double lat) throws Exception {
        return om.readTree(String.format(java.util.Locale.ROOT,
                "{\"type\":\"Polygon\",\"coordinates\":[[[%1$s,%2$s],[%3$s,%2$s],[%3$s,%4$s],[%1$s,%2$s]]]}",
                lon, lat, lon + 0.1, lat + 0.1));
    }

    private RawAlert alert(String id, String event, String severity, JsonNode geometry,
            Instant effective, Instant expires, String... zones) {
        List<String> zoneUrls = new ArrayList<>();
        for (String z : zones)
            zoneUrls.add(ZONE_URL + z);
        return new RawAlert(id, event, severity, "Likely", "Expected", event + " headline " + id,
                "desc " + id, "instr " + id, "Area " + id, zoneUrls, geometry, effective, expires);
    }

    // -- Grouping + primary selection --

    @Test
    void merge_shouldCollapseEventIntoOneAlertLedByHighestSeverity() throws Exception {
        RawAlert severe = alert("urn:a1", "Winter Storm Warning", "Severe", square(-72.5, 44.0),
                T0, T0.plusSeconds(7200), "VTZ001", "NHZ010");
        RawAlert extreme = alert("urn:a2", "Winter Storm Warning", "Extreme", square(-72.9, 44.5),
                T0.minusSeconds(3600), T0.plusSeconds(3600), "VTZ002");

        for (List<RawAlert> input : List.of(List.of(severe, extreme), List.of(extreme, severe))) {
            List<MergedAlert> merged = engine.merge(input, "VT");

            assertEquals(1, merged.size());
            MergedAlert m = merged.get(0);
            assertEquals("urn:a2", m.id());
            assertEquals("Extreme", m.severity());
            assertEquals("Winter Storm Warning headline urn:a2", m.headline());
            assertEquals(Set.of("urn:a1", "urn:a2"), Set.copyOf(m.mergedFrom()));
            assertEquals(Set.of("VTZ001", "VTZ002"), m.affectedZoneIds());
            assertEquals(T0.minusSeconds(3600), m.effective());
            assertEquals(T0.plusSeconds(7200), m.expires());
            assertEquals("MultiPolygon", m.geometry().get("type").asText());
            assertEquals(2, m.geometry().get("coordinates").size());
        }
        verify(nws, never()).zoneBoundary(anyString());
    }

    @Test
    void merge_shouldUseOnlyInlineGeometryWhenAnyMemberHasIt() throws Exception {
        JsonNode p1 = square(-72.5, 44.0);
        RawAlert withShape = alert("urn:a", "Flood Warning", "Severe", p1, T0, T0.plusSeconds(600), "VTZ001");
        RawAlert zoneOnly = alert("urn:b", "Flood Warning", "Severe", null, T0, T0.plusSeconds(600), "VTZ002");

        MergedAlert m = engine.merge(List.of(withShape, zoneOnly), "VT").get(0);

        assertEquals(1, m.geometry().get("coordinates").size());
        assertEquals(p1.get("coordinates"), m.geometry().get("coordinates").get(0));
        verify(nws, never()).zoneBoundary(anyString());
    }

    @Test
    void merge_shouldBreakRankTiesByEarliestEffective() throws Exception {
        RawAlert later = alert("urn:b", "Flood Watch", "Moderate", null, T0.plusSeconds(60), T0.plusSeconds(600),
                "VTZ001");
        RawAlert earlier = alert("urn:a", "Flood Watch", "Moderate", null, T0, T0.plusSeconds(600), "VTZ001");
        when(nws.zoneBoundary("VTZ001")).thenReturn(null);

        MergedAlert m = engine.merge(List.of(later, earlier), "VT").get(0);

        assertEquals("urn:a", m.id());
        assertNull(m.geometry());
        assertEquals("Area urn:a", m.areaDesc());
    }

    @Test
    void merge_shouldKeepSeparateGroupsPerEventType() throws Exception {
        List<MergedAlert> merged = engine.merge(List.of(
                alert("urn:1", "Wind Advisory", "Moderate", square(-72, 44), T0, T0.plusSeconds(60), "VTZ001"),
                alert("urn:2", "Flood Watch", "Severe", square(-73, 44), T0, T0.plusSeconds(60), "VTZ004")), "VT");

        assertEquals(List.of("Wind Advisory", "Flood Watch"), merged.stream().map(MergedAlert::event).toList());
    }

    // -- Region filter --

    @Test
    void merge_shouldSkipGroupWithoutRegionZones() throws Exception {
        RawAlert nh = alert("urn:nh", "Heat Advisory", "Minor", square(-71.5, 43.0), T0, T0.plusSeconds(60),
                "NHZ001", "NHZ002");

        assertTrue(engine.merge(List.of(nh), "VT").isEmpty());
        verify(nws, never()).zoneBoundary(anyString());
    }

    @Test
    void merge_shouldReturnEmptyForNoAlerts() {
        assertTrue(engine.merge(Collections.emptyList(), "VT").isEmpty());
    }

    // -- Zone fallback --

    @Test
    void merge_shouldUseZoneOutlinesWhenNoInlineGeometry() throws Exception {
        when(nws.zoneBoundary("VTZ001"))
                .thenReturn(new ZoneBoundary("VTZ001", "Grand Isle", "VT", square(-73.3, 44.7)));
        when(nws.zoneBoundary("VTZ002"))
                .thenReturn(new ZoneBoundary("VTZ002", "Western Franklin", "VT", square(-73.1, 44.9)));

        MergedAlert m = engine.merge(List.of(
                alert("urn:z", "Winter Weather Advisory", "Moderate", null, T0, T0.plusSeconds(60),
                        "VTZ001", "VTZ002")),
                "VT").get(0);

        assertEquals(2, m.geometry().get("coordinates").size());
        assertEquals("Grand Isle; Western Franklin", m.areaDesc());
    }

    @Test
    void merge_shouldFetchOnlyRegionZonesAcrossGroupMembers() throws Exception {
        when(nws.zoneBoundary("VTZ001"))
                .thenReturn(new ZoneBoundary("VTZ001", "Grand Isle", "VT", square(-73.3, 44.7)));
        when(nws.zoneBoundary("VTZ002"))
                .thenReturn(new ZoneBoundary("VTZ002", "Western Franklin", "VT", square(-73.1, 44.9)));

        List<MergedAlert> merged = engine.merge(List.of(
                alert("urn:a", "Flood Watch", "Moderate", null, T0, T0.plusSeconds(60), "VTZ001", "NHZ005"),
                alert("urn:b", "Flood Watch", "Moderate", null, T0, T0.plusSeconds(60), "VTZ002")),
                "VT");

        assertEquals(1, merged.size());
        MergedAlert m = merged.get(0);
        assertEquals(2, m.geometry().get("coordinates").size());
        assertEquals(Set.of("VTZ001", "VTZ002"), m.affectedZoneIds());
        assertEquals(Set.of("urn:a", "urn:b"), Set.copyOf(m.mergedFrom()));
        verify(nws, never()).zoneBoundary("NHZ005");
    }

    @Test
    void merge_shouldOmitZoneThatFailsToLoad() throws Exception {
        when(nws.zoneBoundary("VTZ001"))
                .thenReturn(new ZoneBoundary("VTZ001", "Grand Isle", "VT", square(-73.3, 44.7)));
        when(nws.zoneBoundary("VTZ002"))
                .thenThrow(new UpstreamUnavailableException(NwsClient.SOURCE, ZONE_URL + "VTZ002", 503));

        MergedAlert m = engine.merge(List.of(
                alert("urn:z", "Winter Weather Advisory", "Moderate", null, T0, T0.plusSeconds(60),
                        "VTZ001", "VTZ002")),
                "VT").get(0);

        assertEquals(1, m.geometry().get("coordinates").size());
        assertEquals("Grand Isle", m.areaDesc());
        assertEquals(Set.of("VTZ001", "VTZ002"), m.affectedZoneIds());
    }

    @Test
    void mergedAlerts_shouldFetchActiveAlertsForRegion() throws Exception {
        when(nws.activeAlerts("VT")).thenReturn(List.of(
                alert("urn:x", "Dense Fog Advisory", "Minor", square(-72.6, 44.3), T0, T0.plusSeconds(60),
                        "VTZ006")));

        List<MergedAlert> merged = engine.mergedAlerts("VT");

        assertEquals(1, merged.size());
        assertEquals("urn:x", merged.get(0).id());
    }

    // -- Geometry --

    @Test
    void concatPolygons_shouldFlattenMultiPolygons() throws Exception {
        JsonNode multi = om.readTree("{\"type\":\"MultiPolygon\",\"coordinates\":[[[[0,0],[1,0],[1,1],[0,0]]],"
                + "[[[2,2],[3,2],[3,3],[2,2]]]]}");
        JsonNode point = om.readTree("{\"type\":\"Point\",\"coordinates\":[0,0]}");

        JsonNode out = engine.concatPolygons(List.of(square(5, 5), multi, point));

        assertEquals(3, out.get("coordinates").size());
        assertNull(engine.concatPolygons(List.of()));
        assertNull(engine.concatPolygons(List.of(point)));
    }

    @Test
    void priority_shouldRankSeverityBeforeCertaintyAndUrgency() {
        RawAlert minorCertain = new RawAlert("a", "E", "Minor", "Observed", "Immediate", null, null, null, null,
                List.of(), null, T0, T0);
        RawAlert moderateUnlikely = new RawAlert("b", "E", "Moderate", "Unlikely", "Past", null, null, null, null,
                List.of(), null, T0, T0);

        List<RawAlert> sorted = new ArrayList<>(List.of(minorCertain, moderateUnlikely));
        sorted.sort(AlertMergeEngine.PRIORITY);
        assertEquals("b", sorted.get(0).id());
    }
}
