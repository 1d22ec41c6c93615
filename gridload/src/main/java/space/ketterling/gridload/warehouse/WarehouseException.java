package space.ketterling.gridload.warehouse;

/**
 * A DuckDB operation on the warehouse failed.
 */
public class WarehouseException extends RuntimeException {
    public WarehouseException(String message, Throwable cause) {
        super(message, cause);
    }
}
