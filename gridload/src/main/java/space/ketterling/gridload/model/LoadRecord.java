package space.ketterling.gridload.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Common shape of a canonical load row, system or zonal.
 */
public interface LoadRecord {
    String iso();

    Instant tsUtc();

    /** Wall-clock time as reported by the feed, offset dropped. */
    LocalDateTime tsLocal();

    /** Null when the feed value could not be read as a number. */
    Double loadMw();

    RecordKey identityKey();

    /**
     * UTC calendar day this row belongs to; history partitions are cut on it.
     */
    default LocalDate utcDate() {
        return tsUtc().atOffset(ZoneOffset.UTC).toLocalDate();
    }
}
