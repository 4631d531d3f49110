package space.ketterling.liveview.db;

import com.zaxxer.hikari.HikariDataSource;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.List;

/**
 * Append-only store of station observations, unique on (station_id, observed_at).
 */
public class ObservationRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ObservationRepo.class);

    public ObservationRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Inserts all rows in one transaction; rows that already exist are skipped.
     * Returns the number of rows actually inserted.
     */
    public int insertIgnoringDuplicates(List<ObservationRow> rows) throws Exception {
        if (rows.isEmpty())
            return 0;
        String sql = "INSERT INTO weather_observations (" +
                "station_id, station_name, latitude, longitude, observed_at, temperature_f, humidity, " +
                "wind_speed_mph, wind_direction, pressure_mb, description) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT (station_id, observed_at) DO NOTHING";

        int inserted;
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (ObservationRow r : rows) {
                    ps.setString(1, r.stationId());
                    ps.setString(2, r.stationName());
                    Jdbc.setDecimal(ps, 3, r.latitude());
                    Jdbc.setDecimal(ps, 4, r.longitude());
                    Jdbc.setInstant(ps, 5, r.observedAt());
                    Jdbc.setDecimal(ps, 6, r.temperatureF());
                    Jdbc.setDecimal(ps, 7, r.humidity());
                    Jdbc.setDecimal(ps, 8, r.windSpeedMph());
                    ps.setString(9, r.windDirection());
                    Jdbc.setInteger(ps, 10, r.pressureMb());
                    ps.setString(11, r.description());
                    ps.addBatch();
                }
                inserted = Jdbc.sum(ps.executeBatch());
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
        log.debug("insertIgnoringDuplicates: submitted={} inserted={}", rows.size(), inserted);
        return inserted;
    }

    public long count() throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM weather_observations");
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * One observation row; measurements are fixed-point.
     */
    public record ObservationRow(
            String stationId,
            String stationName,
            BigDecimal latitude,
            BigDecimal longitude,
            Instant observedAt,
            BigDecimal temperatureF,
            BigDecimal humidity,
            BigDecimal windSpeedMph,
            String windDirection,
            Integer pressureMb,
            String description) {
    }
}
