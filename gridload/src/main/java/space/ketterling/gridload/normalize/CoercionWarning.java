package space.ketterling.gridload.normalize;

import space.ketterling.gridload.model.Dataset;

/**
 * A field that could not be read as its expected type. The row either keeps a
 * null in that field or, when the field is the timestamp, is rejected.
 */
public record CoercionWarning(Dataset dataset, String field, String rawValue, String reason) {
    @Override
    public String toString() {
        return dataset.tableName() + "." + field + "='" + rawValue + "': " + reason;
    }
}
