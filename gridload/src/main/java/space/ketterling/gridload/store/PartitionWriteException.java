package space.ketterling.gridload.store;

import java.nio.file.Path;

/**
 * Writing or committing a partition failed. The partition keeps its last
 * committed content.
 */
public class PartitionWriteException extends RuntimeException {
    private final Path partition;

    public PartitionWriteException(Path partition, Throwable cause) {
        super("Failed to write partition " + partition + ": " + cause.getMessage(), cause);
        this.partition = partition;
    }

    public Path partition() {
        return partition;
    }
}
