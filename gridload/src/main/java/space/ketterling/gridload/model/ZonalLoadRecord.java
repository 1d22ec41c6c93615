package space.ketterling.gridload.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Five-minute estimated load for one load zone.
 *
 * <p>
 * At least one of {@code zoneId} / {@code zoneName} is always set.
 * </p>
 */
public record ZonalLoadRecord(
        String iso,
        Instant tsUtc,
        LocalDateTime tsLocal,
        String zoneId,
        String zoneName,
        Double loadMw) implements LoadRecord {

    public ZonalLoadRecord {
        Objects.requireNonNull(tsUtc, "tsUtc");
        if (zoneId == null && zoneName == null)
            throw new IllegalArgumentException("zoneId and zoneName cannot both be null");
    }

    /**
     * Keyed on the zone id; zones only known by name are keyed on the name so
     * that two unknown zones at the same timestamp stay distinct.
     */
    @Override
    public RecordKey identityKey() {
        return new RecordKey(tsUtc, zoneId != null ? zoneId : "name:" + zoneName);
    }
}
