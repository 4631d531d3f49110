package space.ketterling.liveview.db;

import space.ketterling.liveview.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates the pooled database connection using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds the collector pool, or returns null when no JDBC URL is configured
     * (collectors then run as no-ops).
     */
    public static HikariDataSource createIngestDataSource(AppConfig cfg) {
        if (!cfg.databaseConfigured())
            return null;
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("liveview-ingest");
        hc.setMaximumPoolSize(Math.max(2, cfg.dbPoolMax()));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
