package space.ketterling.gridload.ingest;

import space.ketterling.gridload.model.Dataset;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything one ingest run did, per dataset and payload.
 */
public record CycleSummary(
        String runId,
        String job,
        Instant startedAt,
        Instant finishedAt,
        List<DatasetOutcome> outcomes) {

    public CycleSummary {
        outcomes = List.copyOf(outcomes);
    }

    /** True when no dataset failed; skipped datasets do not count as failures. */
    public boolean success() {
        return outcomes.stream().allMatch(DatasetOutcome::ok);
    }

    public int totalAdded() {
        return outcomes.stream().mapToInt(DatasetOutcome::totalAdded).sum();
    }

    public int totalAdded(Dataset dataset) {
        return outcomes.stream()
                .filter(o -> o.dataset() == dataset)
                .mapToInt(DatasetOutcome::totalAdded)
                .sum();
    }

    public int totalWarnings() {
        return outcomes.stream().mapToInt(DatasetOutcome::warnings).sum();
    }

    public int totalRejected() {
        return outcomes.stream().mapToInt(DatasetOutcome::rejected).sum();
    }

    public List<DatasetOutcome> failures() {
        return outcomes.stream().filter(o -> !o.ok()).toList();
    }

    /**
     * One-line text for logs, e.g. {@code system_load[current] +12 | zonal_load[current] ERROR ...}.
     */
    public String describe() {
        return outcomes.stream().map(o -> {
            String head = o.dataset().tableName() + "[" + o.source() + "] ";
            if (o.skipped())
                return head + "skipped (locked)";
            if (!o.ok())
                return head + "ERROR " + o.error();
            return head + "+" + o.totalAdded() + " " + o.rowsAdded();
        }).collect(Collectors.joining(" | "));
    }
}
