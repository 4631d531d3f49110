package space.ketterling.liveview.traffic;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import space.ketterling.liveview.http.MalformedResponseException;
import space.ketterling.liveview.http.UpstreamHttp;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Vt511ClientTest {

    private static final String FEED = """
            <c2cMessagePublication>
              <informationResponse>
                <incidents>
                  <incident>
                    <id>123</id>
                    <headline>Crash on I-89</headline>
                    <description>Two vehicle Accident near exit 10</description>
                    <severity>high</severity>
                    <roadName>I-89 N</roadName>
                    <location><lat>44336000</lat><lon>-72756000</lon></location>
                    <startTime>2026-10-19T11:30:00-04:00</startTime>
                  </incident>
                  <incident>
                    <id>124</id>
                    <eventType>RoadWork</eventType>
                    <severity>low</severity>
                    <route><routeDesignator>US-2</routeDesignator></route>
                    <lat>44260000</lat>
                    <lon>-72580000</lon>
                  </incident>
                  <incident>
                    <id>125</id>
                    <headline>Ghost incident</headline>
                    <lat>0</lat>
                    <lon>0</lon>
                  </incident>
                  <incident>
                    <headline>No identifier</headline>
                    <lat>44000000</lat>
                    <lon>-72000000</lon>
                  </incident>
                </incidents>
              </informationResponse>
            </c2cMessagePublication>
            """;

    @Mock
    private UpstreamHttp http;

    private Vt511Client client;

    @BeforeEach
    void setUp() {
        client = new Vt511Client(http, new XmlMapper(), Vt511Client.DEFAULT_BASE_URL);
    }

    @Test
    void parse_shouldExtractIncidentsAndDropInvalidOnes() {
        List<TrafficIncident> incidents = client.parse(FEED);

        assertEquals(2, incidents.size());

        TrafficIncident crash = incidents.get(0);
        assertEquals("vt511-123", crash.sourceId());
        assertEquals("ACCIDENT", crash.type());
        assertEquals("MAJOR", crash.severity());
        assertEquals("Crash on I-89", crash.title());
        assertEquals("I-89 N", crash.roadName());
        assertEquals(44.336, crash.latitude(), 1e-9);
        assertEquals(-72.756, crash.longitude(), 1e-9);
        assertEquals(Instant.parse("2026-10-19T15:30:00Z"), crash.startedAt());

        TrafficIncident work = incidents.get(1);
        assertEquals("vt511-124", work.sourceId());
        assertEquals("CONSTRUCTION", work.type());
        assertEquals("MINOR", work.severity());
        assertEquals("Traffic Incident", work.title());
        assertEquals("US-2", work.roadName());
        assertNull(work.startedAt());
    }

    @Test
    void parse_shouldAcceptSingleIncident() {
        String xml = "<root><incident><id>9</id><lat>44100000</lat><lon>-72100000</lon></incident></root>";

        List<TrafficIncident> incidents = client.parse(xml);

        assertEquals(1, incidents.size());
        assertEquals("vt511-9", incidents.get(0).sourceId());
        assertEquals("HAZARD", incidents.get(0).type());
        assertEquals("MODERATE", incidents.get(0).severity());
    }

    @Test
    void parse_shouldReturnEmptyWhenNoIncidents() {
        assertTrue(client.parse("<root><status>ok</status></root>").isEmpty());
    }

    @Test
    void parse_shouldRejectUnparseableBody() {
        assertThrows(MalformedResponseException.class, () -> client.parse("<root><unclosed></root>"));
    }

    @Test
    void currentIncidents_shouldQueryVermontNetwork() {
        when(http.get(eq(Vt511Client.SOURCE), contains("networks=Vermont&dataTypes=incidentData"), anyString()))
                .thenReturn(FEED);

        assertEquals(2, client.currentIncidents().size());
    }

    @Test
    void classify_shouldMapKnownKeywords() {
        assertEquals("CONSTRUCTION", Vt511Client.classify("Construction zone"));
        assertEquals("ACCIDENT", Vt511Client.classify("Accident"));
        assertEquals("CLOSURE", Vt511Client.classify("BridgeOut"));
        assertEquals("CLOSURE", Vt511Client.classify("Road Closure"));
        assertEquals("HAZARD", Vt511Client.classify("Debris"));
    }

    @Test
    void severity_shouldDefaultToModerate() {
        assertEquals("MINOR", Vt511Client.severity("Low"));
        assertEquals("MAJOR", Vt511Client.severity("HIGH"));
        assertEquals("MODERATE", Vt511Client.severity("medium"));
        assertEquals("MODERATE", Vt511Client.severity(null));
    }
}
