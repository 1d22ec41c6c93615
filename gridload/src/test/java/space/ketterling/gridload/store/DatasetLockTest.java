package space.ketterling.gridload.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import space.ketterling.gridload.model.Dataset;

import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DatasetLockTest {

    @TempDir
    Path dataDir;

    @Test
    void secondWriterIsTurnedAwayUntilTheFirstReleases() throws Exception {
        StorageLayout layout = new StorageLayout(dataDir);

        Optional<DatasetLock> first = DatasetLock.tryAcquire(layout, Dataset.SYSTEM);
        assertThat(first).isPresent();
        assertThat(first.get().file()).isEqualTo(dataDir.resolve("history/.system_load.lock"));

        assertThat(DatasetLock.tryAcquire(layout, Dataset.SYSTEM)).isEmpty();
        try (DatasetLock other = DatasetLock.tryAcquire(layout, Dataset.ZONAL).orElseThrow()) {
            assertThat(other.file()).hasFileName(".zonal_load.lock");
        }

        first.get().close();
        try (DatasetLock again = DatasetLock.tryAcquire(layout, Dataset.SYSTEM).orElseThrow()) {
            assertThat(again.file()).exists();
        }
    }
}
