package space.ketterling.gridload.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import space.ketterling.gridload.isone.FeedSource;
import space.ketterling.gridload.isone.FetchedPayload;
import space.ketterling.gridload.isone.TransportException;
import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;
import space.ketterling.gridload.normalize.CoercionWarning;
import space.ketterling.gridload.normalize.NormalizedBatch;
import space.ketterling.gridload.normalize.PayloadNormalizer;
import space.ketterling.gridload.normalize.UnexpectedShapeException;
import space.ketterling.gridload.store.DatasetLock;
import space.ketterling.gridload.store.HistoryStore;
import space.ketterling.gridload.store.PartitionWriteException;
import space.ketterling.gridload.store.RecordCsvCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs ingest cycles: fetch, keep the raw body, normalize, append to history.
 *
 * <p>
 * Each dataset is its own failure domain; an error in one is recorded in the
 * cycle summary and never stops the other.
 * </p>
 */
public final class IngestService {
    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final FeedSource source;
    private final HistoryStore history;
    private final Map<Dataset, PayloadNormalizer<? extends LoadRecord>> normalizers = new EnumMap<>(Dataset.class);
    private final DebugArtifacts artifacts;
    private final IngestRunLog runLog;
    private final Clock clock;

    public IngestService(FeedSource source, HistoryStore history,
            List<? extends PayloadNormalizer<? extends LoadRecord>> normalizers,
            DebugArtifacts artifacts, IngestRunLog runLog, Clock clock) {
        this.source = source;
        this.history = history;
        for (PayloadNormalizer<? extends LoadRecord> n : normalizers)
            this.normalizers.put(n.dataset(), n);
        for (Dataset d : Dataset.values()) {
            if (!this.normalizers.containsKey(d))
                throw new IllegalArgumentException("No normalizer for " + d.tableName());
        }
        this.artifacts = artifacts;
        this.runLog = runLog;
        this.clock = clock;
    }

    /**
     * Fetches the current payload of each requested dataset and appends it.
     */
    public CycleSummary runOnce(Set<Dataset> datasets) {
        return run("poll", () -> {
            List<DatasetOutcome> out = new ArrayList<>();
            for (Dataset d : Dataset.values()) {
                if (datasets.contains(d))
                    out.add(ingest(d, "current", () -> source.fetchCurrent(d)));
            }
            return out;
        });
    }

    /**
     * Fetches the day endpoint for each of the {@code days} UTC days before
     * {@code today}, newest first.
     */
    public CycleSummary backfill(int days, Set<Dataset> datasets, LocalDate today) {
        if (days < 0)
            throw new IllegalArgumentException("days must be >= 0, got " + days);
        return run("backfill", () -> {
            List<DatasetOutcome> out = new ArrayList<>();
            for (int i = 1; i <= days; i++) {
                LocalDate day = today.minusDays(i);
                log.info("Backfilling {}", day);
                for (Dataset d : Dataset.values()) {
                    if (datasets.contains(d))
                        out.add(ingest(d, day.toString(), () -> source.fetchDay(d, day)));
                }
            }
            return out;
        });
    }

    /**
     * Backfill relative to the current UTC date.
     */
    public CycleSummary backfill(int days, Set<Dataset> datasets) {
        return backfill(days, datasets, LocalDate.now(clock.withZone(ZoneOffset.UTC)));
    }

    private CycleSummary run(String job, Supplier<List<DatasetOutcome>> body) {
        String runId = UUID.randomUUID().toString();
        Instant started = clock.instant();
        MDC.put("runId", runId.substring(0, 8));
        try {
            log.info("Ingest {} started", job);
            List<DatasetOutcome> outcomes = body.get();
            CycleSummary summary = new CycleSummary(runId, job, started, clock.instant(), outcomes);
            if (summary.success())
                log.info("Ingest {} finished: {}", job, summary.describe());
            else
                log.warn("Ingest {} finished with errors: {}", job, summary.describe());
            try {
                runLog.append(summary);
            } catch (RuntimeException e) {
                log.warn("Failed to record run {}: {}", runId, e.getMessage());
            }
            return summary;
        } finally {
            MDC.remove("runId");
        }
    }

    private DatasetOutcome ingest(Dataset dataset, String sourceLabel, Supplier<FetchedPayload> fetch) {
        MDC.put("dataset", dataset.tableName());
        try (DatasetLock lock = DatasetLock.tryAcquire(history.layout(), dataset).orElse(null)) {
            if (lock == null) {
                log.warn("{} is locked by another writer, skipping", dataset.tableName());
                return DatasetOutcome.skipped(dataset, sourceLabel);
            }
            FetchedPayload payload;
            try {
                payload = fetch.get();
            } catch (TransportException e) {
                artifacts.saveRaw(dataset, sourceLabel + "_error", e.body(), false);
                log.warn("Fetch failed for {}: {}", dataset.tableName(), e.getMessage());
                return DatasetOutcome.failed(dataset, sourceLabel, "fetch: " + e.getMessage());
            }
            return ingestPayload(dataset, sourceLabel, payload);
        } catch (IOException e) {
            log.warn("Cannot lock {}: {}", dataset.tableName(), e.getMessage());
            return DatasetOutcome.failed(dataset, sourceLabel, "lock: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Ingest of {} failed", dataset.tableName(), e);
            return DatasetOutcome.failed(dataset, sourceLabel, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            MDC.remove("dataset");
        }
    }

    /**
     * Normalizes and appends one already-fetched payload. The caller holds
     * the dataset's writer lock when running concurrently with other
     * processes.
     */
    public DatasetOutcome ingestPayload(Dataset dataset, String sourceLabel, FetchedPayload payload) {
        artifacts.saveRaw(dataset, sourceLabel, payload.body(), true);
        return append(normalizers.get(dataset), sourceLabel, payload);
    }

    private <R extends LoadRecord> DatasetOutcome append(PayloadNormalizer<R> normalizer, String sourceLabel,
            FetchedPayload payload) {
        Dataset dataset = normalizer.dataset();
        NormalizedBatch<R> batch;
        try {
            batch = normalizer.normalize(payload.json());
        } catch (UnexpectedShapeException e) {
            Optional<Path> saved = artifacts.saveUnexpectedShape(dataset, e.payload());
            log.warn("{} ({})", e.getMessage(), saved.map(p -> "saved to " + p).orElse("not saved"));
            return DatasetOutcome.failed(dataset, sourceLabel, "shape: " + e.getMessage()
                    + saved.map(p -> " [" + p + "]").orElse(""));
        }

        for (CoercionWarning w : batch.warnings())
            log.warn("Coercion: {}", w);
        artifacts.saveRejected(dataset, batch.rejected());

        @SuppressWarnings("unchecked")
        RecordCsvCodec<R> codec = (RecordCsvCodec<R>) history.codec(dataset);
        artifacts.stageLatest(codec, batch.records());

        SortedMap<LocalDate, Integer> added;
        try {
            added = history.appendBatch(batch.records(), dataset);
        } catch (PartitionWriteException e) {
            log.warn("History write failed for {}: {}", dataset.tableName(), e.getMessage());
            return new DatasetOutcome(dataset, sourceLabel, new TreeMap<>(), batch.records().size(),
                    batch.warnings().size(), batch.rejected().size(), "write: " + e.getMessage(), false);
        }
        return new DatasetOutcome(dataset, sourceLabel, added, batch.records().size(), batch.warnings().size(),
                batch.rejected().size(), null, false);
    }
}
