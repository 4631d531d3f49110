package space.ketterling.liveview.config;

import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for persistence, upstream feeds,
 * collector schedules, retries and the health API.
 * </p>
 */
public record AppConfig(
        // DB (blank URL = persistence unconfigured)
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,
        boolean dbMigrate,

        // Upstream
        String contactEmail,
        String region,
        int httpTimeoutSeconds,
        int fetchParallelism,

        // Collector schedules
        boolean collectorEnabled,
        Duration observations,
        Duration alerts,
        Duration incidents,
        Duration gauges,
        Duration startupDelay,

        // Retry
        int retryMaxRetries,
        long retryBaseDelayMs,

        // API
        int apiPort,
        String adminToken) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        return load(loadProperties("application.properties"));
    }

    /**
     * Builds configuration from an explicit properties fallback; env vars and
     * JVM properties still take precedence.
     */
    public static AppConfig load(Properties p) {
        String dbUrl = envOr(p, "DB_JDBC_URL", "db.jdbcUrl", "");
        String dbUser = envOr(p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        int dbPoolMax = Integer.parseInt(envOr(p, "DB_POOL_MAX", "db.poolMax", "6"));
        boolean dbMigrate = Boolean.parseBoolean(envOr(p, "DB_MIGRATE", "db.migrate", "true"));

        String contact = envOr(p, "CONTACT_EMAIL", "nws.contactEmail", "weather-app@localhost");
        String region = envOr(p, "REGION", "ingest.region", "VT").trim().toUpperCase(Locale.ROOT);
        int timeout = Integer.parseInt(envOr(p, "HTTP_TIMEOUT_SECONDS", "http.timeoutSeconds", "10"));
        int parallelism = Integer.parseInt(envOr(p, "FETCH_PARALLELISM", "fetch.parallelism", "8"));

        boolean enabled = Boolean.parseBoolean(envOr(p, "ENABLE_COLLECTOR", "collector.enabled", "true"));
        Duration obs = Duration.parse(envOr(p, "SCHED_OBSERVATIONS", "schedule.observations", "PT5M"));
        Duration al = Duration.parse(envOr(p, "SCHED_ALERTS", "schedule.alerts", "PT2M"));
        Duration inc = Duration.parse(envOr(p, "SCHED_INCIDENTS", "schedule.incidents", "PT3M"));
        Duration gg = Duration.parse(envOr(p, "SCHED_GAUGES", "schedule.gauges", "PT10M"));
        Duration startup = Duration.parse(envOr(p, "SCHED_STARTUP_DELAY", "schedule.startupDelay", "PT5S"));

        int maxRetries = Integer.parseInt(envOr(p, "RETRY_MAX_RETRIES", "retry.maxRetries", "3"));
        long baseDelay = Long.parseLong(envOr(p, "RETRY_BASE_DELAY_MS", "retry.baseDelayMs", "1000"));

        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "4000"));
        String adminToken = envOr(p, "ADMIN_TOKEN", "admin.token", "");

        if (region.isBlank()) {
            throw new IllegalStateException("ingest.region must not be blank");
        }
        if (maxRetries < 1) {
            throw new IllegalStateException("retry.maxRetries must be >= 1, got " + maxRetries);
        }

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax,
                dbMigrate,

                contact,
                region,
                timeout,
                parallelism,

                enabled,
                obs,
                al,
                inc,
                gg,
                startup,

                maxRetries,
                baseDelay,

                port,
                adminToken);
    }

    /**
     * True when a JDBC URL is configured; collectors no-op otherwise.
     */
    public boolean databaseConfigured() {
        return dbJdbcUrl != null && !dbJdbcUrl.isBlank();
    }

    /**
     * User-Agent sent to weather.gov, which requires contact information.
     */
    public String userAgent() {
        return "VT-Liveview Weather App (" + contactEmail + ")";
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private static Properties loadProperties(String resource) {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            throw new IllegalStateException("Unable to read " + resource, e);
        }
        return p;
    }

    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }
}
