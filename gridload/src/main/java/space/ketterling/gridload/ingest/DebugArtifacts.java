package space.ketterling.gridload.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;
import space.ketterling.gridload.store.AtomicFiles;
import space.ketterling.gridload.store.RecordCsvCodec;
import space.ketterling.gridload.store.StorageLayout;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Files kept for traceability: raw bodies, unexpected payloads, rejected
 * nodes and the latest normalized snapshot per dataset.
 *
 * <p>
 * Failing to write one of these never fails ingestion; the error is logged.
 * </p>
 */
public final class DebugArtifacts {
    private static final Logger log = LoggerFactory.getLogger(DebugArtifacts.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'",
            Locale.ROOT);

    private final StorageLayout layout;
    private final ObjectMapper om;
    private final Clock clock;

    public DebugArtifacts(StorageLayout layout, ObjectMapper om, Clock clock) {
        this.layout = layout;
        this.om = om;
        this.clock = clock;
    }

    String stamp() {
        return STAMP.format(clock.instant().atOffset(ZoneOffset.UTC));
    }

    /**
     * Stores a fetched body byte-for-byte under {@code raw/}.
     */
    public Optional<Path> saveRaw(Dataset dataset, String source, byte[] body, boolean json) {
        if (body == null)
            return Optional.empty();
        Path file = layout.rawDir().resolve(dataset.shortName() + "_" + sanitize(source) + "_" + stamp()
                + (json ? ".json" : ".bin"));
        return write(file, body);
    }

    /**
     * Stores a payload no record could be read from, for offline inspection.
     */
    public Optional<Path> saveUnexpectedShape(Dataset dataset, JsonNode payload) {
        Path file = layout.rawDir().resolve("unexpected_shape_" + dataset.tableName() + "_" + stamp() + ".json");
        try {
            byte[] bytes = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(payload);
            return write(file, bytes);
        } catch (IOException e) {
            log.warn("Failed to serialize unexpected payload for {}: {}", dataset.tableName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes rejected nodes as JSON lines.
     */
    public Optional<Path> saveRejected(Dataset dataset, List<JsonNode> rejected) {
        if (rejected.isEmpty())
            return Optional.empty();
        Path file = layout.rejectedDir().resolve(dataset.tableName() + "_" + stamp() + ".jsonl");
        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (JsonNode n : rejected) {
                    w.write(om.writeValueAsString(n));
                    w.write('\n');
                }
            }
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Failed to write rejected rows to {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replaces {@code staged/{dataset}_latest.csv} with the newest batch.
     */
    public <R extends LoadRecord> Optional<Path> stageLatest(RecordCsvCodec<R> codec, List<? extends R> records) {
        Path file = layout.stagedDir().resolve(codec.dataset().shortName() + "_latest.csv");
        Path tmp = AtomicFiles.tempFor(file);
        try {
            Files.createDirectories(file.getParent());
            codec.write(tmp, records);
            AtomicFiles.commit(tmp, file);
            return Optional.of(file);
        } catch (IOException e) {
            AtomicFiles.discard(tmp);
            log.warn("Failed to stage {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> write(Path file, byte[] bytes) {
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, bytes);
            log.debug("Saved {} ({} bytes)", file, bytes.length);
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Failed to save {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static String sanitize(String s) {
        return s.replaceAll("[^A-Za-z0-9_-]", "");
    }
}
