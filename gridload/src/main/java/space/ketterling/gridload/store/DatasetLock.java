package space.ketterling.gridload.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.gridload.model.Dataset;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Process-wide writer lock for one dataset's history, held as an OS file
 * lock on {@code {history}/.{dataset}.lock}.
 */
public final class DatasetLock implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DatasetLock.class);

    private final Path file;
    private final FileChannel channel;
    private final FileLock lock;

    private DatasetLock(Path file, FileChannel channel, FileLock lock) {
        this.file = file;
        this.channel = channel;
        this.lock = lock;
    }

    public static Path lockFile(StorageLayout layout, Dataset dataset) {
        return layout.historyDir().resolve("." + dataset.tableName() + ".lock");
    }

    /**
     * Takes the lock without waiting; empty when another writer holds it.
     */
    public static Optional<DatasetLock> tryAcquire(StorageLayout layout, Dataset dataset) throws IOException {
        Path file = lockFile(layout, dataset);
        Files.createDirectories(file.getParent());
        FileChannel ch = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            FileLock l = ch.tryLock();
            if (l == null) {
                ch.close();
                return Optional.empty();
            }
            return Optional.of(new DatasetLock(file, ch, l));
        } catch (OverlappingFileLockException e) {
            ch.close();
            return Optional.empty();
        } catch (IOException e) {
            ch.close();
            throw e;
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public void close() {
        try {
            lock.release();
        } catch (IOException e) {
            log.warn("Failed to release {}: {}", file, e.getMessage());
        } finally {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("Failed to close {}: {}", file, e.getMessage());
            }
        }
    }
}
