package space.ketterling.gridload.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTest {

    @Test
    void resolvesShortAndTableNames() {
        assertThat(Dataset.fromName("system")).isEqualTo(Dataset.SYSTEM);
        assertThat(Dataset.fromName(" ZONAL ")).isEqualTo(Dataset.ZONAL);
        assertThat(Dataset.fromName("zonal_load")).isEqualTo(Dataset.ZONAL);
    }

    @Test
    void unknownNameIsRejected() {
        assertThatThrownBy(() -> Dataset.fromName("hourly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hourly");
        assertThatThrownBy(() -> Dataset.fromName(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zonalRecordNeedsAnIdOrAName() {
        Instant ts = Instant.parse("2024-01-01T05:05:00Z");

        assertThatThrownBy(() -> new ZonalLoadRecord("ISONE", ts, null, null, null, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new ZonalLoadRecord("ISONE", ts, null, null, "Mystery", 1.0).identityKey())
                .isEqualTo(new RecordKey(ts, "name:Mystery"));
        assertThat(new ZonalLoadRecord("ISONE", ts, null, "4001", "ME", 1.0).identityKey())
                .isEqualTo(new RecordKey(ts, "4001"));
    }

    @Test
    void utcDateFollowsTheUtcInstant() {
        SystemLoadRecord late = new SystemLoadRecord("ISONE", Instant.parse("2024-01-01T23:55:00Z"),
                null, "ISONE", 1.0, true);
        SystemLoadRecord early = new SystemLoadRecord("ISONE", Instant.parse("2024-01-02T00:00:00Z"),
                null, "ISONE", 1.0, true);

        assertThat(late.utcDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(early.utcDate()).isEqualTo(LocalDate.of(2024, 1, 2));
    }

    @Test
    void keysOrderByTimeThenId() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        Instant t1 = Instant.parse("2024-01-01T00:05:00Z");

        assertThat(new RecordKey(t0, "4008").compareTo(new RecordKey(t1, "4001"))).isNegative();
        assertThat(new RecordKey(t0, "4001").compareTo(new RecordKey(t0, "4002"))).isNegative();
    }
}
