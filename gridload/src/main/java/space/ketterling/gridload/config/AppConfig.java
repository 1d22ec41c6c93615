package space.ketterling.gridload.config;

import space.ketterling.gridload.store.StorageLayout;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups the feed credentials, the data directory layout, the
 * warehouse database and the ingest schedules.
 * </p>
 */
public record AppConfig(
        // ISO-NE web services
        String isoneUsername,
        String isonePassword,
        String isoneBaseUrl,
        Duration httpTimeout,
        String isoCode,

        // Storage
        Path dataDir,
        Path duckdbPath,
        int duckdbPoolMax,

        // Schedules
        Duration pollInterval,
        Duration warehouseRebuild,

        // API
        int apiPort) {

    public static final String DEFAULT_BASE_URL = "https://webservices.iso-ne.com/api/v1.1";

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable application.properties", e);
        }
        return from(System.getenv(), System.getProperties(), p);
    }

    /**
     * Builds a config from explicit sources; {@link #load()} passes the
     * process environment and system properties.
     */
    public static AppConfig from(Map<String, String> env, Properties sys, Properties file) {
        Source s = new Source(env, sys, file);

        String user = s.get("ISONE_USERNAME", "isone.username", "");
        String pass = s.get("ISONE_PASSWORD", "isone.password", "");
        String baseUrl = stripTrailingSlash(s.get("ISONE_BASE_URL", "isone.baseUrl", DEFAULT_BASE_URL));
        Duration timeout = duration(s, "HTTP_TIMEOUT", "isone.timeout", "PT30S");
        String iso = s.get("ISO_CODE", "iso.code", "ISONE");

        Path dataDir = Path.of(s.get("DATA_DIR", "data.dir", "data"));
        String dbPath = s.get("DUCKDB_PATH", "duckdb.path", "");
        Path duckdb = dbPath.isBlank() ? dataDir.resolve("warehouse").resolve("isone.duckdb") : Path.of(dbPath);
        int poolMax = integer(s, "DUCKDB_POOL_MAX", "duckdb.poolMax", "4");

        Duration poll = duration(s, "POLL_INTERVAL", "schedule.poll", "PT5M");
        Duration rebuild = duration(s, "WAREHOUSE_REBUILD", "schedule.warehouseRebuild", "PT1H");
        if (poll.isZero() || poll.isNegative())
            throw new IllegalStateException("schedule.poll must be positive, got " + poll);

        int port = integer(s, "API_PORT", "api.port", "8080");

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                user,
                pass,
                baseUrl,
                timeout,
                iso,

                dataDir,
                duckdb,
                poolMax,

                poll,
                rebuild,

                port);
    }

    /**
     * Directory layout rooted at {@link #dataDir()}.
     */
    public StorageLayout layout() {
        return new StorageLayout(dataDir);
    }

    public boolean hasCredentials() {
        return !isoneUsername.isBlank() && !isonePassword.isBlank();
    }

    /**
     * Fails when the feed credentials are missing; fetching needs them.
     */
    public AppConfig requireCredentials() {
        if (!hasCredentials()) {
            throw new IllegalStateException(
                    "Missing ISONE_USERNAME / ISONE_PASSWORD (env var, -Dprop, or application.properties).");
        }
        return this;
    }

    /**
     * Same config with another poll interval (CLI override).
     */
    public AppConfig withPollInterval(Duration interval) {
        return new AppConfig(isoneUsername, isonePassword, isoneBaseUrl, httpTimeout, isoCode, dataDir, duckdbPath,
                duckdbPoolMax, interval, warehouseRebuild, apiPort);
    }

    @Override
    public String toString() {
        return "AppConfig[user=" + isoneUsername + ", password=" + (isonePassword.isEmpty() ? "<unset>" : "***")
                + ", baseUrl=" + isoneBaseUrl + ", iso=" + isoCode + ", dataDir=" + dataDir + ", duckdb="
                + duckdbPath + ", poll=" + pollInterval + ", rebuild=" + warehouseRebuild + ", port=" + apiPort + "]";
    }

    // ----------------------------
    // helpers
    // ----------------------------

    private static Duration duration(Source s, String envKey, String propKey, String def) {
        String v = s.get(envKey, propKey, def);
        try {
            return Duration.parse(v);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid duration for " + propKey + ": " + v, e);
        }
    }

    private static int integer(Source s, String envKey, String propKey, String def) {
        String v = s.get(envKey, propKey, def);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + propKey + ": " + v, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String u = url.trim();
        while (u.endsWith("/"))
            u = u.substring(0, u.length() - 1);
        return u;
    }

    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private record Source(Map<String, String> env, Properties sys, Properties file) {
        String get(String envKey, String propKey, String def) {
            String v = env.get(envKey);
            if (v != null && !v.isBlank())
                return v;
            String prop = sys.getProperty(propKey);
            if (prop != null && !prop.isBlank())
                return prop;
            return file.getProperty(propKey, def);
        }
    }
}
