package space.ketterling.gridload.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;
import space.ketterling.gridload.model.RecordKey;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Append-only daily history with merge-on-key.
 *
 * <p>
 * Each dataset has one CSV partition per UTC day. Appending merges the batch
 * into the existing partition, keeping the last row seen for each identity
 * key, and replaces the file through {@link AtomicFiles#commit}. Appending the
 * same batch twice leaves the partition unchanged.
 * </p>
 *
 * <p>
 * Writers to the same (dataset, day) must be serialized by the caller; see
 * {@link DatasetLock}.
 * </p>
 */
public final class HistoryStore {
    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    private final StorageLayout layout;
    private final Map<Dataset, RecordCsvCodec<? extends LoadRecord>> codecs = new EnumMap<>(Dataset.class);

    public HistoryStore(StorageLayout layout, String iso) {
        this.layout = layout;
        for (Dataset d : Dataset.values())
            codecs.put(d, RecordCsvCodec.forDataset(d, iso));
    }

    public StorageLayout layout() {
        return layout;
    }

    public RecordCsvCodec<? extends LoadRecord> codec(Dataset dataset) {
        return codecs.get(dataset);
    }

    /**
     * Merges a batch into the history of one dataset.
     *
     * @return rows added per touched partition date (zero when every row was
     *         already present)
     * @throws PartitionWriteException when a partition cannot be read or
     *                                 replaced; partitions already committed
     *                                 in this call stay committed
     */
    public SortedMap<LocalDate, Integer> appendBatch(List<? extends LoadRecord> records, Dataset dataset) {
        if (records == null || records.isEmpty())
            return new TreeMap<>();
        return append(records, codecs.get(dataset));
    }

    private <R extends LoadRecord> SortedMap<LocalDate, Integer> append(List<? extends LoadRecord> records,
            RecordCsvCodec<R> codec) {
        SortedMap<LocalDate, List<R>> byDate = new TreeMap<>();
        for (LoadRecord r : records) {
            if (!codec.type().isInstance(r)) {
                throw new IllegalArgumentException("Record " + r + " does not belong to "
                        + codec.dataset().tableName());
            }
            byDate.computeIfAbsent(r.utcDate(), d -> new ArrayList<>()).add(codec.type().cast(r));
        }

        SortedMap<LocalDate, Integer> added = new TreeMap<>();
        for (Map.Entry<LocalDate, List<R>> e : byDate.entrySet()) {
            int n = mergePartition(codec, e.getKey(), e.getValue());
            added.put(e.getKey(), n);
            log.info("{} {}: +{} rows ({} in batch)", codec.dataset().tableName(), e.getKey(), n,
                    e.getValue().size());
        }
        return added;
    }

    private <R extends LoadRecord> int mergePartition(RecordCsvCodec<R> codec, LocalDate date, List<R> incoming) {
        Path file = layout.partitionFile(codec.dataset(), date);
        Path tmp = AtomicFiles.tempFor(file);
        try {
            Files.createDirectories(file.getParent());
            List<R> existing = codec.read(file);

            Map<RecordKey, R> merged = new LinkedHashMap<>();
            for (R r : existing)
                merged.put(r.identityKey(), r);
            for (R r : incoming)
                merged.put(r.identityKey(), r);

            List<R> rows = new ArrayList<>(merged.values());
            rows.sort(Comparator.comparing(LoadRecord::identityKey));

            codec.write(tmp, rows);
            AtomicFiles.commit(tmp, file);
            log.debug("Committed {} ({} rows, {} before)", file, rows.size(), existing.size());
            return rows.size() - existing.size();
        } catch (IOException e) {
            AtomicFiles.discard(tmp);
            throw new PartitionWriteException(file, e);
        }
    }

    /**
     * Rows of one partition in file order; empty when the partition does not
     * exist.
     */
    public List<? extends LoadRecord> readPartition(Dataset dataset, LocalDate date) {
        Path file = layout.partitionFile(dataset, date);
        try {
            return codecs.get(dataset).read(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read partition " + file, e);
        }
    }

    /**
     * Dates that have a partition for the dataset, ascending.
     */
    public List<LocalDate> listPartitions(Dataset dataset) {
        Path dir = layout.historyDir();
        if (!Files.isDirectory(dir))
            return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .map(p -> layout.partitionDate(dataset, p))
                    .flatMap(Optional::stream)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
    }
}
