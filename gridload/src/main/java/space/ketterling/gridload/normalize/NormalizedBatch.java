package space.ketterling.gridload.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;

import java.util.List;

/**
 * Output of one normalization: canonical rows in sort order, plus what had to
 * be degraded or left out. Rejected nodes are kept verbatim for offline
 * diagnosis.
 */
public record NormalizedBatch<R extends LoadRecord>(
        Dataset dataset,
        List<R> records,
        List<CoercionWarning> warnings,
        List<JsonNode> rejected) {

    public NormalizedBatch {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
        rejected = List.copyOf(rejected);
    }
}
