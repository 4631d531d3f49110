package space.ketterling.liveview.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.liveview.traffic.TrafficIncident;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Database access for traffic incidents and their presence lifecycle.
 *
 * <p>
 * resolved_at is written only while it is null, so a resolved incident stays
 * resolved even if its id shows up in the feed again.
 * </p>
 */
public class IncidentRepo {
    private final HikariDataSource ds;
    private final ObjectMapper om;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(IncidentRepo.class);

    public IncidentRepo(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    /**
     * Inserts a first sighting or advances last_seen_at of a known source id.
     */
    public void upsertSeen(TrafficIncident inc, Instant seenAt) throws Exception {
        String sql = "INSERT INTO traffic_incidents (" +
                "source_id, incident_type, severity, title, description, latitude, longitude, road_name, " +
                "affected_lanes, geometry, started_at, first_seen_at, last_seen_at, source) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (source_id) DO UPDATE SET last_seen_at = excluded.last_seen_at";

        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, inc.sourceId());
            ps.setString(2, inc.type());
            ps.setString(3, inc.severity());
            ps.setString(4, truncate(inc.title(), 255));
            ps.setString(5, inc.description());
            Jdbc.setDecimal(ps, 6, degrees(inc.latitude()));
            Jdbc.setDecimal(ps, 7, degrees(inc.longitude()));
            ps.setString(8, truncate(inc.roadName(), 255));
            ps.setString(9, truncate(inc.affectedLanes(), 255));
            ps.setString(10, inc.geometry() == null ? null : om.writeValueAsString(inc.geometry()));
            Jdbc.setInstant(ps, 11, inc.startedAt());
            Jdbc.setInstant(ps, 12, seenAt);
            Jdbc.setInstant(ps, 13, seenAt);
            ps.setString(14, "VT 511");
            ps.executeUpdate();
        }
        log.debug("upsertSeen: sourceId={} type={}", inc.sourceId(), inc.type());
    }

    /**
     * Marks every active incident whose id is not in {@code currentIds} as
     * resolved. Returns the number of rows that changed state.
     */
    public int resolveMissing(Collection<String> currentIds, Instant resolvedAt) throws Exception {
        StringBuilder sql = new StringBuilder(
                "UPDATE traffic_incidents SET resolved_at = ? WHERE resolved_at IS NULL");
        if (!currentIds.isEmpty()) {
            sql.append(" AND source_id NOT IN (");
            sql.append("?,".repeat(currentIds.size()));
            sql.setLength(sql.length() - 1);
            sql.append(')');
        }

        int updated;
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql.toString())) {
            Jdbc.setInstant(ps, 1, resolvedAt);
            int i = 2;
            for (String id : currentIds) {
                ps.setString(i++, id);
            }
            updated = ps.executeUpdate();
        }
        log.debug("resolveMissing: active ids={} resolved={}", currentIds.size(), updated);
        return updated;
    }

    public Optional<IncidentRow> find(String sourceId) throws Exception {
        String sql = "SELECT source_id, incident_type, severity, title, road_name, first_seen_at, last_seen_at, "
                + "resolved_at FROM traffic_incidents WHERE source_id = ?";
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sourceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                return Optional.of(new IncidentRow(
                        rs.getString("source_id"),
                        rs.getString("incident_type"),
                        rs.getString("severity"),
                        rs.getString("title"),
                        rs.getString("road_name"),
                        Jdbc.getInstant(rs, "first_seen_at"),
                        Jdbc.getInstant(rs, "last_seen_at"),
                        Jdbc.getInstant(rs, "resolved_at")));
            }
        }
    }

    public long count() throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM traffic_incidents");
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static BigDecimal degrees(double v) {
        return BigDecimal.valueOf(v).setScale(6, RoundingMode.HALF_UP);
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }

    public record IncidentRow(
            String sourceId,
            String incidentType,
            String severity,
            String title,
            String roadName,
            Instant firstSeenAt,
            Instant lastSeenAt,
            Instant resolvedAt) {

        public boolean active() {
            return resolvedAt == null;
        }
    }
}
