/*
* Copyright 2025 Taylor Ketterling
* Query facade for gridload, an ISO-NE load ingestion and warehouse application.
* Exposes the Parquet warehouse as DuckDB views and answers the read queries
* used by the HTTP API.
*/

package space.ketterling.gridload.warehouse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.SystemLoadRecord;
import space.ketterling.gridload.model.TimestampParser;
import space.ketterling.gridload.model.ZonalLoadRecord;
import space.ketterling.gridload.store.StorageLayout;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the warehouse.
 *
 * <p>
 * {@link #defineViews()} points the {@code system_load} and
 * {@code zonal_load} views of the DuckDB file at the Parquet segments; data
 * is never copied into the database. Timestamps are compared as epoch
 * milliseconds so results do not depend on session time zone handling.
 * </p>
 */
public final class QueryFacade {
    private static final Logger log = LoggerFactory.getLogger(QueryFacade.class);

    private static final String SYSTEM_COLS = "iso, epoch_ms(ts_utc) AS ts_ms, CAST(ts_local AS VARCHAR) AS ts_local, "
            + "location, load_mw, is_system";
    private static final String ZONAL_COLS = "iso, epoch_ms(ts_utc) AS ts_ms, CAST(ts_local AS VARCHAR) AS ts_local, "
            + "zone_id, zone_name, load_mw";

    private final DataSource ds;
    private final StorageLayout layout;

    public QueryFacade(DataSource ds, StorageLayout layout) {
        this.ds = ds;
        this.layout = layout;
    }

    /**
     * Creates or replaces both views. A dataset without segments gets an empty
     * view with the segment columns.
     */
    public void defineViews() {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (Dataset d : Dataset.values()) {
                String body;
                if (layout.hasSegments(d)) {
                    body = "SELECT * FROM read_parquet(" + quote(layout.segmentGlob(d))
                            + ", hive_partitioning = false)";
                } else {
                    body = SegmentSchema.of(d).emptySelect();
                }
                st.execute("CREATE OR REPLACE VIEW " + d.tableName() + " AS " + body);
                log.debug("View {} -> {}", d.tableName(), body);
            }
        } catch (SQLException e) {
            throw new WarehouseException("Failed to define warehouse views", e);
        }
        log.info("Warehouse views defined");
    }

    /**
     * Largest timestamp in a view, if it has rows.
     */
    public Optional<Instant> latestTimestamp(Dataset dataset) {
        String sql = "SELECT max(epoch_ms(ts_utc)) FROM " + dataset.tableName();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                long ms = rs.getLong(1);
                if (!rs.wasNull())
                    return Optional.of(Instant.ofEpochMilli(ms));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new WarehouseException("latestTimestamp(" + dataset.tableName() + ") failed", e);
        }
    }

    public List<SystemLoadRecord> systemAt(Instant ts) {
        String sql = "SELECT " + SYSTEM_COLS + " FROM system_load WHERE epoch_ms(ts_utc) = ? ORDER BY location";
        return querySystem(sql, ts.toEpochMilli());
    }

    public List<ZonalLoadRecord> zonesAt(Instant ts) {
        String sql = "SELECT " + ZONAL_COLS
                + " FROM zonal_load WHERE epoch_ms(ts_utc) = ? ORDER BY zone_id NULLS LAST, zone_name";
        return queryZonal(sql, ts.toEpochMilli());
    }

    public List<SystemLoadRecord> latestSystem() {
        return latestTimestamp(Dataset.SYSTEM).map(this::systemAt).orElse(List.of());
    }

    public List<ZonalLoadRecord> latestZonal() {
        return latestTimestamp(Dataset.ZONAL).map(this::zonesAt).orElse(List.of());
    }

    /**
     * Compares the zone sum to the system total at {@code ts}; empty when
     * either side has no usable rows.
     */
    public Optional<ParityReport> parity(Instant ts) {
        String systemSql = """
                SELECT load_mw FROM system_load
                WHERE epoch_ms(ts_utc) = ? AND is_system AND load_mw IS NOT NULL
                ORDER BY location
                LIMIT 1
                """;
        String zonesSql = """
                SELECT count(load_mw) AS n, sum(load_mw) AS total FROM zonal_load
                WHERE epoch_ms(ts_utc) = ?
                """;
        try (Connection c = ds.getConnection()) {
            Double system = null;
            try (PreparedStatement ps = c.prepareStatement(systemSql)) {
                ps.setLong(1, ts.toEpochMilli());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next())
                        system = rs.getDouble(1);
                }
            }
            if (system == null)
                return Optional.empty();

            try (PreparedStatement ps = c.prepareStatement(zonesSql)) {
                ps.setLong(1, ts.toEpochMilli());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next() || rs.getLong("n") == 0)
                        return Optional.empty();
                    return Optional.of(new ParityReport(ts, system, rs.getDouble("total"), (int) rs.getLong("n")));
                }
            }
        } catch (SQLException e) {
            throw new WarehouseException("parity(" + ts + ") failed", e);
        }
    }

    /**
     * Zonal rows within {@code hours} of the newest zonal timestamp.
     */
    public List<ZonalLoadRecord> zonalWindow(int hours) {
        Optional<Instant> latest = latestTimestamp(Dataset.ZONAL);
        if (latest.isEmpty())
            return List.of();
        Instant cutoff = latest.get().minus(Duration.ofHours(hours));
        String sql = "SELECT " + ZONAL_COLS + " FROM zonal_load WHERE epoch_ms(ts_utc) >= ? "
                + "ORDER BY ts_utc, zone_id NULLS LAST, zone_name";
        return queryZonal(sql, cutoff.toEpochMilli());
    }

    /**
     * Average load per zone, weekday and hour of the reported wall clock over
     * the last {@code days} days of zonal data.
     */
    public List<HourlyProfilePoint> hourlyProfile(int days) {
        Optional<Instant> latest = latestTimestamp(Dataset.ZONAL);
        if (latest.isEmpty())
            return List.of();
        Instant cutoff = latest.get().minus(Duration.ofDays(days));
        String sql = """
                SELECT coalesce(zone_name, zone_id) AS zone, isodow(ts_local) AS dow, hour(ts_local) AS hr,
                       avg(load_mw) AS avg_mw, count(load_mw) AS n
                FROM zonal_load
                WHERE epoch_ms(ts_utc) >= ? AND ts_local IS NOT NULL AND load_mw IS NOT NULL
                GROUP BY 1, 2, 3
                ORDER BY 1, 2, 3
                """;
        List<HourlyProfilePoint> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, cutoff.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new HourlyProfilePoint(rs.getString("zone"), rs.getInt("dow"), rs.getInt("hr"),
                            rs.getDouble("avg_mw"), rs.getLong("n")));
                }
            }
        } catch (SQLException e) {
            throw new WarehouseException("hourlyProfile(" + days + ") failed", e);
        }
        return out;
    }

    public Map<Dataset, Long> rowCounts() {
        Map<Dataset, Long> out = new EnumMap<>(Dataset.class);
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (Dataset d : Dataset.values()) {
                try (ResultSet rs = st.executeQuery("SELECT count(*) FROM " + d.tableName())) {
                    out.put(d, rs.next() ? rs.getLong(1) : 0L);
                }
            }
        } catch (SQLException e) {
            throw new WarehouseException("rowCounts failed", e);
        }
        return out;
    }

    /**
     * Cheap connectivity check for health endpoints.
     */
    public boolean ping() {
        try (Connection c = ds.getConnection();
                Statement st = c.createStatement();
                ResultSet rs = st.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            log.warn("Warehouse ping failed: {}", e.getMessage());
            return false;
        }
    }

    private List<SystemLoadRecord> querySystem(String sql, long param) {
        List<SystemLoadRecord> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SystemLoadRecord(
                            rs.getString("iso"),
                            Instant.ofEpochMilli(rs.getLong("ts_ms")),
                            local(rs.getString("ts_local")),
                            rs.getString("location"),
                            nullableDouble(rs, "load_mw"),
                            rs.getBoolean("is_system")));
                }
            }
        } catch (SQLException e) {
            throw new WarehouseException("system_load query failed", e);
        }
        return out;
    }

    private List<ZonalLoadRecord> queryZonal(String sql, long param) {
        List<ZonalLoadRecord> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ZonalLoadRecord(
                            rs.getString("iso"),
                            Instant.ofEpochMilli(rs.getLong("ts_ms")),
                            local(rs.getString("ts_local")),
                            rs.getString("zone_id"),
                            rs.getString("zone_name"),
                            nullableDouble(rs, "load_mw")));
                }
            }
        } catch (SQLException e) {
            throw new WarehouseException("zonal_load query failed", e);
        }
        return out;
    }

    private static Double nullableDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }

    private static LocalDateTime local(String text) {
        return TimestampParser.parse(text).map(TimestampParser.Parsed::local).orElse(null);
    }

    private static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
