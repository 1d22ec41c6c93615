package space.ketterling.gridload.warehouse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;
import space.ketterling.gridload.store.AtomicFiles;
import space.ketterling.gridload.store.HistoryStore;
import space.ketterling.gridload.store.StorageLayout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the Parquet warehouse from the history partitions.
 *
 * <p>
 * Every partition is re-read and rewritten as one segment per day; nothing is
 * carried over from a previous build. Each segment goes through a
 * {@code .tmp} file and {@link AtomicFiles#commit}, so readers never see a
 * half-written file. Uses an in-memory DuckDB connection for the Parquet
 * encoding; the warehouse database file is not touched.
 * </p>
 */
public final class WarehouseCompactor {
    private static final Logger log = LoggerFactory.getLogger(WarehouseCompactor.class);

    private final HistoryStore history;
    private final StorageLayout layout;
    private final String iso;

    public WarehouseCompactor(HistoryStore history, String iso) {
        this.history = history;
        this.layout = history.layout();
        this.iso = iso;
    }

    /**
     * Rebuilds both datasets.
     *
     * @return rows written per dataset
     */
    public Map<Dataset, Integer> rebuild() {
        Map<Dataset, Integer> out = new EnumMap<>(Dataset.class);
        for (Dataset d : Dataset.values())
            out.put(d, rebuild(d));
        return out;
    }

    /**
     * Rebuilds every segment of one dataset.
     *
     * @return rows written
     */
    public int rebuild(Dataset dataset) {
        List<LocalDate> dates = history.listPartitions(dataset);
        if (dates.isEmpty()) {
            log.info("No {} history partitions, nothing to compact", dataset.tableName());
            return 0;
        }
        SegmentSchema schema = SegmentSchema.of(dataset);
        int total = 0;
        try (Connection c = DriverManager.getConnection("jdbc:duckdb:")) {
            try (Statement st = c.createStatement()) {
                st.execute("SET TimeZone = 'UTC'");
            }
            for (LocalDate date : dates) {
                total += writeSegment(c, schema, date);
            }
        } catch (SQLException e) {
            throw new WarehouseException("Compaction of " + dataset.tableName() + " failed", e);
        }
        log.info("Compacted {}: {} partitions, {} rows", dataset.tableName(), dates.size(), total);
        return total;
    }

    private int writeSegment(Connection c, SegmentSchema schema, LocalDate date) throws SQLException {
        Dataset dataset = schema.dataset();
        List<? extends LoadRecord> rows = history.readPartition(dataset, date);
        Path target = layout.segmentFile(dataset, date, iso);
        Path tmp = AtomicFiles.tempFor(target);
        String table = "seg_" + dataset.tableName();

        try {
            Files.createDirectories(target.getParent());
            try (Statement st = c.createStatement()) {
                st.execute("CREATE OR REPLACE TEMP TABLE " + table + " (" + schema.columns() + ")");
            }
            try (PreparedStatement ps = c.prepareStatement(schema.insertSql(table))) {
                for (LoadRecord r : rows) {
                    schema.bind(ps, r, iso);
                    ps.addBatch();
                }
                if (!rows.isEmpty())
                    ps.executeBatch();
            }
            try (Statement st = c.createStatement()) {
                st.execute("COPY (SELECT * FROM " + table + " ORDER BY " + schema.orderBy() + ") TO "
                        + sqlLiteral(tmp) + " (FORMAT PARQUET)");
                st.execute("DROP TABLE " + table);
            }
            AtomicFiles.commit(tmp, target);
        } catch (IOException e) {
            AtomicFiles.discard(tmp);
            throw new UncheckedIOException("Cannot write segment " + target, e);
        } catch (SQLException e) {
            AtomicFiles.discard(tmp);
            throw e;
        }
        log.debug("Wrote {} ({} rows)", target, rows.size());
        return rows.size();
    }

    static String sqlLiteral(Path p) {
        String s = p.toAbsolutePath().normalize().toString().replace('\\', '/');
        return "'" + s.replace("'", "''") + "'";
    }
}
