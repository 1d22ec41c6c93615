package space.ketterling.gridload.warehouse;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;
import space.ketterling.gridload.model.SystemLoadRecord;
import space.ketterling.gridload.model.ZonalLoadRecord;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Fixed column layout of a dataset's Parquet segments and its query view.
 */
public enum SegmentSchema {
    SYSTEM_LOAD(Dataset.SYSTEM,
            "iso VARCHAR, ts_utc TIMESTAMPTZ, ts_local TIMESTAMP, location VARCHAR, load_mw DOUBLE, is_system BOOLEAN",
            "ts_utc, location"),
    ZONAL_LOAD(Dataset.ZONAL,
            "iso VARCHAR, ts_utc TIMESTAMPTZ, ts_local TIMESTAMP, zone_id VARCHAR, zone_name VARCHAR, load_mw DOUBLE",
            "ts_utc, zone_id NULLS LAST, zone_name NULLS LAST");

    private static final DateTimeFormatter SQL_TS = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS",
            Locale.ROOT);

    private final Dataset dataset;
    private final String columns;
    private final String orderBy;

    SegmentSchema(Dataset dataset, String columns, String orderBy) {
        this.dataset = dataset;
        this.columns = columns;
        this.orderBy = orderBy;
    }

    public static SegmentSchema of(Dataset dataset) {
        return switch (dataset) {
            case SYSTEM -> SYSTEM_LOAD;
            case ZONAL -> ZONAL_LOAD;
        };
    }

    public Dataset dataset() {
        return dataset;
    }

    /** Column definitions, e.g. for CREATE TABLE. */
    public String columns() {
        return columns;
    }

    public String orderBy() {
        return orderBy;
    }

    /**
     * A typed relation with this schema and no rows, used as the view body
     * before the first segment exists.
     */
    public String emptySelect() {
        StringBuilder sb = new StringBuilder("SELECT ");
        String[] defs = columns.split(",\\s*");
        for (int i = 0; i < defs.length; i++) {
            String[] nameType = defs[i].trim().split("\\s+");
            if (i > 0)
                sb.append(", ");
            sb.append("CAST(NULL AS ").append(nameType[1]).append(") AS ").append(nameType[0]);
        }
        return sb.append(" WHERE false").toString();
    }

    public String insertSql(String table) {
        return "INSERT INTO " + table + " VALUES (?, CAST(? AS TIMESTAMPTZ), CAST(? AS TIMESTAMP), ?, ?, ?)";
    }

    /**
     * Binds one record to {@link #insertSql}. Timestamps travel as text so
     * the driver never applies the JVM time zone.
     */
    public void bind(PreparedStatement ps, LoadRecord r, String fallbackIso) throws SQLException {
        String iso = r.iso() == null || r.iso().isBlank() ? fallbackIso : r.iso();
        ps.setString(1, iso);
        ps.setString(2, utcText(r.tsUtc()));
        if (r.tsLocal() == null)
            ps.setNull(3, Types.VARCHAR);
        else
            ps.setString(3, localText(r.tsLocal()));
        switch (this) {
            case SYSTEM_LOAD -> {
                SystemLoadRecord s = (SystemLoadRecord) r;
                ps.setString(4, s.location());
                setLoad(ps, 5, s.loadMw());
                ps.setBoolean(6, s.isSystem());
            }
            case ZONAL_LOAD -> {
                ZonalLoadRecord z = (ZonalLoadRecord) r;
                ps.setString(4, z.zoneId());
                ps.setString(5, z.zoneName());
                setLoad(ps, 6, z.loadMw());
            }
        }
    }

    private static void setLoad(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }

    static String utcText(Instant t) {
        return SQL_TS.format(t.atOffset(ZoneOffset.UTC)) + "+00";
    }

    static String localText(LocalDateTime t) {
        return SQL_TS.format(t);
    }
}
