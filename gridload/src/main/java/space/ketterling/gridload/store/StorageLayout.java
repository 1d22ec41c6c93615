package space.ketterling.gridload.store;

import space.ketterling.gridload.model.Dataset;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * On-disk layout under the data directory, shared by the history store, the
 * compactor and the query facade.
 *
 * <pre>
 * {data}/history/{dataset}_{YYYY-MM-DD}.csv
 * {data}/warehouse/{dataset}/date={YYYY-MM-DD}/part-{ISO}-{YYYYMMDD}.parquet
 * {data}/raw, staged, rejected, logs
 * </pre>
 */
public record StorageLayout(Path dataDir) {
    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ROOT);
    private static final Pattern PARTITION_NAME = Pattern.compile("([a-z_]+)_(\\d{4}-\\d{2}-\\d{2})\\.csv");

    public StorageLayout {
        Objects.requireNonNull(dataDir, "dataDir");
    }

    public Path historyDir() {
        return dataDir.resolve("history");
    }

    public Path warehouseDir() {
        return dataDir.resolve("warehouse");
    }

    public Path rawDir() {
        return dataDir.resolve("raw");
    }

    public Path stagedDir() {
        return dataDir.resolve("staged");
    }

    public Path rejectedDir() {
        return dataDir.resolve("rejected");
    }

    public Path logsDir() {
        return dataDir.resolve("logs");
    }

    public Path partitionFile(Dataset dataset, LocalDate date) {
        return historyDir().resolve(dataset.tableName() + "_" + date + ".csv");
    }

    /**
     * Date encoded in a partition file name, if the name belongs to the given
     * dataset.
     */
    public Optional<LocalDate> partitionDate(Dataset dataset, Path file) {
        Matcher m = PARTITION_NAME.matcher(file.getFileName().toString());
        if (!m.matches() || !m.group(1).equals(dataset.tableName()))
            return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(m.group(2)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public Path datasetWarehouseDir(Dataset dataset) {
        return warehouseDir().resolve(dataset.tableName());
    }

    public Path segmentFile(Dataset dataset, LocalDate date, String iso) {
        return datasetWarehouseDir(dataset)
                .resolve("date=" + date)
                .resolve("part-" + iso + "-" + COMPACT_DATE.format(date) + ".parquet");
    }

    /**
     * Glob matching every segment of a dataset, absolute, with forward
     * slashes.
     */
    public String segmentGlob(Dataset dataset) {
        String base = datasetWarehouseDir(dataset).toAbsolutePath().normalize().toString().replace('\\', '/');
        return base + "/date=*/part-*.parquet";
    }

    public boolean hasSegments(Dataset dataset) {
        Path dir = datasetWarehouseDir(dataset);
        if (!Files.isDirectory(dir))
            return false;
        try (Stream<Path> s = Files.walk(dir, 2)) {
            return s.anyMatch(p -> {
                String n = p.getFileName().toString();
                return n.startsWith("part-") && n.endsWith(".parquet");
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan " + dir, e);
        }
    }

    /**
     * Creates every directory of the layout that does not exist yet.
     */
    public void ensureDirectories() throws IOException {
        for (Path p : new Path[] { historyDir(), warehouseDir(), rawDir(), stagedDir(), rejectedDir(), logsDir() })
            Files.createDirectories(p);
    }
}
