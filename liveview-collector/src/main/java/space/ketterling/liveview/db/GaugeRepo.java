package space.ketterling.liveview.db;

import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.liveview.usgs.GaugeReading;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.List;

/**
 * Append-only store of river gauge readings, unique on (site_code, observed_at).
 */
public class GaugeRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(GaugeRepo.class);

    public GaugeRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Inserts all readings in one transaction, skipping ones already stored.
     * Returns the number actually inserted.
     */
    public int insertIgnoringDuplicates(List<GaugeReading> readings) throws Exception {
        if (readings.isEmpty())
            return 0;
        String sql = "INSERT INTO river_gauges (site_code, site_name, latitude, longitude, observed_at, gage_height_ft) "
                + "VALUES (?, ?, ?, ?, ?, ?) ON CONFLICT (site_code, observed_at) DO NOTHING";

        int inserted;
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (GaugeReading r : readings) {
                    ps.setString(1, r.siteCode());
                    ps.setString(2, r.siteName());
                    Jdbc.setDecimal(ps, 3, scaled(r.latitude(), 6));
                    Jdbc.setDecimal(ps, 4, scaled(r.longitude(), 6));
                    Jdbc.setInstant(ps, 5, r.observedAt());
                    Jdbc.setDecimal(ps, 6, r.gageHeightFt().setScale(2, RoundingMode.HALF_UP));
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
        log.debug("insertIgnoringDuplicates: submitted={} inserted={}", readings.size(), inserted);
        return inserted;
    }

    public long count() throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM river_gauges");
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static BigDecimal scaled(double v, int scale) {
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP);
    }
}
