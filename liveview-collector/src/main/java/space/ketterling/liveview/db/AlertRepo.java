package space.ketterling.liveview.db;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.liveview.alerts.MergedAlert;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Database access for merged weather alerts, keyed by {@code noaa_alert_id}.
 */
public class AlertRepo {
    private final HikariDataSource ds;
    private final ObjectMapper om;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(AlertRepo.class);

    public AlertRepo(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    /**
     * Inserts a first sighting (first_seen_at = last_seen_at = seenAt) or, for a
     * known id, only advances last_seen_at.
     */
    public void upsertSeen(MergedAlert alert, Instant seenAt) throws Exception {
        String sql = "INSERT INTO weather_alerts (" +
                "noaa_alert_id, event_type, severity, certainty, urgency, headline, description, instruction, " +
                "area_desc, affected_zones, merged_from, geometry, effective_at, expires_at, first_seen_at, last_seen_at) "
                +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (noaa_alert_id) DO UPDATE SET last_seen_at = excluded.last_seen_at";

        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, alert.id());
            ps.setString(2, alert.event());
            ps.setString(3, orUnknown(alert.severity()));
            ps.setString(4, orUnknown(alert.certainty()));
            ps.setString(5, orUnknown(alert.urgency()));
            ps.setString(6, alert.headline());
            ps.setString(7, alert.description());
            ps.setString(8, alert.instruction());
            ps.setString(9, alert.areaDesc());
            ps.setString(10, om.writeValueAsString(alert.affectedZoneIds()));
            ps.setString(11, om.writeValueAsString(alert.mergedFrom()));
            ps.setString(12, alert.geometry() == null ? null : om.writeValueAsString(alert.geometry()));
            Jdbc.setInstant(ps, 13, alert.effective());
            Jdbc.setInstant(ps, 14, alert.expires());
            Jdbc.setInstant(ps, 15, seenAt);
            Jdbc.setInstant(ps, 16, seenAt);
            ps.executeUpdate();
        }
        log.debug("upsertSeen: alertId={} event={} severity={}", alert.id(), alert.event(), alert.severity());
    }

    /**
     * Loads one alert row by its natural key.
     */
    public Optional<AlertRow> find(String noaaAlertId) throws Exception {
        String sql = "SELECT noaa_alert_id, event_type, severity, headline, area_desc, affected_zones, geometry, " +
                "effective_at, expires_at, first_seen_at, last_seen_at FROM weather_alerts WHERE noaa_alert_id = ?";
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, noaaAlertId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                String zones = rs.getString("affected_zones");
                return Optional.of(new AlertRow(
                        rs.getString("noaa_alert_id"),
                        rs.getString("event_type"),
                        rs.getString("severity"),
                        rs.getString("headline"),
                        rs.getString("area_desc"),
                        zones == null ? List.of() : om.readValue(zones, new TypeReference<List<String>>() {
                        }),
                        rs.getString("geometry"),
                        Jdbc.getInstant(rs, "effective_at"),
                        Jdbc.getInstant(rs, "expires_at"),
                        Jdbc.getInstant(rs, "first_seen_at"),
                        Jdbc.getInstant(rs, "last_seen_at")));
            }
        }
    }

    public long count() throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM weather_alerts");
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static String orUnknown(String s) {
        return s == null || s.isBlank() ? "Unknown" : s;
    }

    /**
     * Persisted alert; geometry is the stored GeoJSON text.
     */
    public record AlertRow(
            String noaaAlertId,
            String eventType,
            String severity,
            String headline,
            String areaDesc,
            List<String> affectedZones,
            String geometryJson,
            Instant effectiveAt,
            Instant expiresAt,
            Instant firstSeenAt,
            Instant lastSeenAt) {
    }
}
