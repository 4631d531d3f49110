package space.ketterling.liveview.db;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Null-safe parameter binding shared by the repositories.
 */
final class Jdbc {
    private Jdbc() {
    }

    static void setInstant(PreparedStatement ps, int idx, Instant t) throws SQLException {
        if (t == null)
            ps.setNull(idx, Types.TIMESTAMP);
        else
            ps.setTimestamp(idx, Timestamp.from(t));
    }

    static void setDecimal(PreparedStatement ps, int idx, BigDecimal v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DECIMAL);
        else
            ps.setBigDecimal(idx, v);
    }

    static void setInteger(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.INTEGER);
        else
            ps.setInt(idx, v);
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    /**
     * Adds up batch counts, ignoring drivers that report SUCCESS_NO_INFO.
     */
    static int sum(int[] counts) {
        int n = 0;
        for (int c : counts) {
            if (c > 0)
                n += c;
        }
        return n;
    }
}
