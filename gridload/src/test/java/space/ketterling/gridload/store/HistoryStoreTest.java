package space.ketterling.gridload.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import space.ketterling.gridload.TestPayloads;
import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;
import space.ketterling.gridload.model.SystemLoadRecord;
import space.ketterling.gridload.model.ZonalLoadRecord;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class HistoryStoreTest {
    private static final LocalDate JAN1 = LocalDate.of(2024, 1, 1);

    @TempDir
    Path dataDir;

    private StorageLayout layout;
    private HistoryStore store;

    @BeforeEach
    void setUp() {
        layout = new StorageLayout(dataDir);
        store = new HistoryStore(layout, "ISONE");
    }

    private static SystemLoadRecord sys(String ts, String location, Double mw) {
        Instant t = Instant.parse(ts);
        return new SystemLoadRecord("ISONE", t, LocalDateTime.ofInstant(t, ZoneOffset.UTC),
                location, mw, "ISONE".equals(location));
    }

    private List<LoadRecord> rows(Dataset dataset, LocalDate date) {
        return List.copyOf(store.readPartition(dataset, date));
    }

    @Test
    void appendingTheSameBatchTwiceAddsNothingTheSecondTime() throws Exception {
        List<SystemLoadRecord> batch = TestPayloads.systemNormalizer()
                .normalize(TestPayloads.json("system_current.json")).records();

        SortedMap<LocalDate, Integer> first = store.appendBatch(batch, Dataset.SYSTEM);
        byte[] afterFirst = Files.readAllBytes(layout.partitionFile(Dataset.SYSTEM, JAN1));
        SortedMap<LocalDate, Integer> second = store.appendBatch(batch, Dataset.SYSTEM);

        assertThat(first).containsExactly(entry(JAN1, 2));
        assertThat(second).containsExactly(entry(JAN1, 0));
        assertThat(Files.readAllBytes(layout.partitionFile(Dataset.SYSTEM, JAN1))).isEqualTo(afterFirst);
    }

    @Test
    void partitionRoundTripsRecords() {
        List<ZonalLoadRecord> batch = TestPayloads.zonalNormalizer()
                .normalize(TestPayloads.json("zonal_snake_case.json")).records();

        store.appendBatch(batch, Dataset.ZONAL);

        assertThat(rows(Dataset.ZONAL, JAN1)).containsExactlyElementsOf(batch);
    }

    @Test
    void laterRowForTheSameKeyWins() {
        store.appendBatch(List.of(sys("2024-01-01T05:05:00Z", "ISONE", 15000.0)), Dataset.SYSTEM);
        SortedMap<LocalDate, Integer> added = store.appendBatch(
                List.of(sys("2024-01-01T05:05:00Z", "ISONE", 15007.5)), Dataset.SYSTEM);

        assertThat(added).containsExactly(entry(JAN1, 0));
        assertThat(rows(Dataset.SYSTEM, JAN1))
                .extracting(LoadRecord::loadMw)
                .containsExactly(15007.5);
    }

    @Test
    void batchIsSplitByUtcDayAndRowsAreSorted() throws Exception {
        List<SystemLoadRecord> batch = List.of(
                sys("2024-01-02T00:00:00Z", "ISONE", 3.0),
                sys("2024-01-01T23:55:00Z", "NEPOOL", 2.0),
                sys("2024-01-01T23:55:00Z", "ISONE", 1.0),
                sys("2024-01-01T00:00:00Z", "ISONE", null));

        SortedMap<LocalDate, Integer> added = store.appendBatch(batch, Dataset.SYSTEM);

        assertThat(added).containsExactly(entry(JAN1, 3), entry(JAN1.plusDays(1), 1));
        assertThat(rows(Dataset.SYSTEM, JAN1))
                .extracting(r -> r.identityKey().id())
                .containsExactly("ISONE", "ISONE", "NEPOOL");
        assertThat(rows(Dataset.SYSTEM, JAN1).get(0).loadMw()).isNull();
        assertThat(store.listPartitions(Dataset.SYSTEM)).containsExactly(JAN1, JAN1.plusDays(1));
        assertThat(store.listPartitions(Dataset.ZONAL)).isEmpty();

        List<String> lines = Files.readAllLines(layout.partitionFile(Dataset.SYSTEM, JAN1));
        assertThat(lines.get(0)).isEqualTo("iso,ts_utc,ts_local,location,load_mw,is_system");
        assertThat(lines.get(1)).isEqualTo("ISONE,2024-01-01T00:00:00Z,2024-01-01T00:00:00,ISONE,,true");
    }

    @Test
    void noTempFileIsLeftBehind() throws Exception {
        store.appendBatch(List.of(sys("2024-01-01T05:05:00Z", "ISONE", 1.0)), Dataset.SYSTEM);

        try (var files = Files.list(layout.historyDir())) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(n -> n.endsWith(".tmp"));
        }
    }

    @Test
    void wrongRecordTypeIsRefused() {
        assertThatThrownBy(() -> store.appendBatch(List.of(sys("2024-01-01T05:05:00Z", "ISONE", 1.0)),
                Dataset.ZONAL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unreadablePartitionFailsTheWriteAndLeavesItAlone() throws Exception {
        Path partition = layout.partitionFile(Dataset.SYSTEM, JAN1);
        Files.createDirectories(partition.getParent());
        Files.writeString(partition, "iso,ts_utc,ts_local,location,load_mw,is_system\nISONE,garbage,,ISONE,1,true\n");

        assertThatThrownBy(() -> store.appendBatch(List.of(sys("2024-01-01T05:05:00Z", "ISONE", 1.0)),
                Dataset.SYSTEM))
                .isInstanceOfSatisfying(PartitionWriteException.class,
                        e -> assertThat(e.partition()).isEqualTo(partition));
        assertThat(Files.readString(partition)).contains("garbage");
    }

    @Test
    void emptyBatchTouchesNothing() {
        assertThat(store.appendBatch(List.of(), Dataset.SYSTEM)).isEmpty();
        assertThat(Files.exists(layout.historyDir())).isFalse();
    }

    @Test
    void blankIsoCellReadsAsTheDefault() throws Exception {
        Path partition = layout.partitionFile(Dataset.ZONAL, JAN1);
        Files.createDirectories(partition.getParent());
        Files.writeString(partition, "iso,ts_utc,ts_local,zone_id,zone_name,load_mw\n"
                + ",2024-01-01T05:05:00Z,2024-01-01T00:05:00,4001,ME,1200.0\n");

        assertThat(rows(Dataset.ZONAL, JAN1))
                .containsExactly(new ZonalLoadRecord("ISONE", Instant.parse("2024-01-01T05:05:00Z"),
                        LocalDateTime.of(2024, 1, 1, 0, 5), "4001", "ME", 1200.0));
    }
}
