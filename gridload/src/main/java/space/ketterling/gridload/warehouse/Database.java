package space.ketterling.gridload.warehouse;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.gridload.config.AppConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates pooled connections to the DuckDB warehouse file using HikariCP.
 *
 * <p>
 * DuckDB allows one writing process per database file. Connections opened
 * from the same JVM share one database instance, so the pool is safe inside a
 * single process; a second process opening the same file will fail.
 * </p>
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds the pool used by the query facade and the HTTP API.
     */
    public static HikariDataSource createWarehouseDataSource(AppConfig cfg) {
        return createDataSource(cfg.duckdbPath(), "warehouse", cfg.duckdbPoolMax());
    }

    /**
     * Shared helper to build a configured pool for a DuckDB file.
     */
    static HikariDataSource createDataSource(Path dbFile, String role, int maxPool) {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory for " + dbFile, e);
        }
        HikariConfig hc = new HikariConfig();
        hc.setDriverClassName("org.duckdb.DuckDBDriver");
        hc.setJdbcUrl("jdbc:duckdb:" + dbFile.toAbsolutePath());
        hc.setPoolName("gridload-" + role);
        hc.setMaximumPoolSize(Math.max(1, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        hc.setConnectionInitSql("SET TimeZone = 'UTC'");
        return new HikariDataSource(hc);
    }
}
