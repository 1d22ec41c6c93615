package space.ketterling.gridload.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines log of ingest runs ({@code logs/ingest_runs.jsonl}).
 */
public final class IngestRunLog {
    private static final Logger log = LoggerFactory.getLogger(IngestRunLog.class);

    private final Path file;
    private final ObjectMapper om;

    public IngestRunLog(Path file, ObjectMapper om) {
        this.file = file;
        this.om = om;
    }

    public Path file() {
        return file;
    }

    /**
     * Appends one run entry.
     */
    public synchronized void append(CycleSummary summary) {
        ObjectNode row = toJson(summary);
        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(om.writeValueAsString(row));
                w.write('\n');
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to run log " + file, e);
        }
        log.debug("run log <- {} {}", summary.runId(), row.get("status").asText());
    }

    /**
     * Newest entries first, at most {@code limit}. Unparseable lines are
     * skipped.
     */
    public synchronized List<JsonNode> recent(int limit) {
        if (!Files.exists(file))
            return List.of();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read run log " + file, e);
        }
        List<JsonNode> out = new ArrayList<>();
        for (int i = lines.size() - 1; i >= 0 && out.size() < limit; i--) {
            String line = lines.get(i).trim();
            if (line.isEmpty())
                continue;
            try {
                out.add(om.readTree(line));
            } catch (IOException e) {
                log.warn("Skipping unreadable run log line {}: {}", i + 1, e.getMessage());
            }
        }
        return Collections.unmodifiableList(out);
    }

    ObjectNode toJson(CycleSummary s) {
        ObjectNode row = om.createObjectNode();
        row.put("run_id", s.runId());
        row.put("job_name", s.job());
        row.put("started_at", s.startedAt().toString());
        row.put("finished_at", s.finishedAt().toString());
        row.put("status", status(s));
        row.put("notes", s.describe());
        row.put("rows_added", s.totalAdded());
        row.put("warnings", s.totalWarnings());
        row.put("rejected", s.totalRejected());

        ArrayNode arr = row.putArray("outcomes");
        for (DatasetOutcome o : s.outcomes()) {
            ObjectNode on = arr.addObject();
            on.put("dataset", o.dataset().tableName());
            on.put("source", o.source());
            on.put("records", o.records());
            on.put("warnings", o.warnings());
            on.put("rejected", o.rejected());
            on.put("skipped", o.skipped());
            if (o.error() == null)
                on.putNull("error");
            else
                on.put("error", o.error());
            ObjectNode added = on.putObject("rows_added");
            for (Map.Entry<LocalDate, Integer> e : o.rowsAdded().entrySet())
                added.put(e.getKey().toString(), e.getValue());
        }
        return row;
    }

    private static String status(CycleSummary s) {
        if (s.success())
            return "SUCCESS";
        return s.failures().size() == s.outcomes().size() ? "FAILED" : "PARTIAL";
    }
}
