package space.ketterling.gridload.ingest;

import space.ketterling.gridload.model.Dataset;

import java.time.LocalDate;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of ingesting one payload for one dataset.
 *
 * @param source   "current" or the backfilled day
 * @param records  rows the normalizer produced
 * @param error    failure text; null on success
 * @param skipped  true when another writer held the dataset lock
 */
public record DatasetOutcome(
        Dataset dataset,
        String source,
        SortedMap<LocalDate, Integer> rowsAdded,
        int records,
        int warnings,
        int rejected,
        String error,
        boolean skipped) {

    public DatasetOutcome {
        rowsAdded = Collections.unmodifiableSortedMap(new TreeMap<>(rowsAdded));
    }

    static DatasetOutcome failed(Dataset dataset, String source, String error) {
        return new DatasetOutcome(dataset, source, new TreeMap<>(), 0, 0, 0, error, false);
    }

    static DatasetOutcome skipped(Dataset dataset, String source) {
        return new DatasetOutcome(dataset, source, new TreeMap<>(), 0, 0, 0, null, true);
    }

    public boolean ok() {
        return error == null;
    }

    public int totalAdded() {
        return rowsAdded.values().stream().mapToInt(Integer::intValue).sum();
    }
}
