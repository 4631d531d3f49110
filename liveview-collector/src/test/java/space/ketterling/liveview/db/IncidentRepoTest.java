package space.ketterling.liveview.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import space.ketterling.liveview.testutil.TestDatabase;
import space.ketterling.liveview.traffic.TrafficIncident;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IncidentRepoTest {

    private static final Instant T1 = Instant.parse("2026-10-19T12:00:00Z");
    private static final Instant T2 = Instant.parse("2026-10-19T12:03:00Z");
    private static final Instant T3 = Instant.parse("2026-10-19T12:06:00Z");

    @TempDir
    Path tempDir;

    private HikariDataSource ds;
    private IncidentRepo repo;

    @BeforeEach
    void setUp() throws Exception {
        ds = TestDatabase.open(tempDir);
        repo = new IncidentRepo(ds, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        ds.close();
    }

    private static TrafficIncident incident(String id) {
        return new TrafficIncident(id, "ACCIDENT", "MAJOR", "Crash", "Two cars", 44.336, -72.756, "I-89",
                null, null, T1.minusSeconds(600));
    }

    @Test
    void resolveMissing_shouldResolveOnlyAbsentActiveIncidents() throws Exception {
        repo.upsertSeen(incident("vt511-1"), T1);
        repo.upsertSeen(incident("vt511-2"), T1);

        assertEquals(1, repo.resolveMissing(List.of("vt511-1"), T2));

        assertTrue(repo.find("vt511-1").orElseThrow().active());
        assertEquals(T2, repo.find("vt511-2").orElseThrow().resolvedAt());
    }

    @Test
    void resolveMissing_shouldNotRewriteResolvedAt() throws Exception {
        repo.upsertSeen(incident("vt511-1"), T1);
        repo.resolveMissing(List.of(), T2);

        assertEquals(0, repo.resolveMissing(List.of(), T3));
        assertEquals(T2, repo.find("vt511-1").orElseThrow().resolvedAt());
    }

    @Test
    void upsertSeen_shouldNotReactivateResolvedIncident() throws Exception {
        repo.upsertSeen(incident("vt511-1"), T1);
        repo.resolveMissing(List.of(), T2);
        repo.upsertSeen(incident("vt511-1"), T3);

        IncidentRepo.IncidentRow row = repo.find("vt511-1").orElseThrow();
        assertFalse(row.active());
        assertEquals(T2, row.resolvedAt());
        assertEquals(T3, row.lastSeenAt());
        assertEquals(1, repo.count());
    }
}
