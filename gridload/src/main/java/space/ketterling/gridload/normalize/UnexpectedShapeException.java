package space.ketterling.gridload.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import space.ketterling.gridload.model.Dataset;

/**
 * No record could be extracted from a payload. Carries the payload so the
 * caller can keep it for inspection; fatal for that dataset's cycle.
 */
public class UnexpectedShapeException extends RuntimeException {
    private final Dataset dataset;
    private final transient JsonNode payload;

    public UnexpectedShapeException(Dataset dataset, JsonNode payload, String message) {
        super(message);
        this.dataset = dataset;
        this.payload = payload;
    }

    public Dataset dataset() {
        return dataset;
    }

    public JsonNode payload() {
        return payload;
    }
}
