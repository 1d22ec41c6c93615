package space.ketterling.gridload.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Five-minute load for the whole system (or one reported location).
 */
public record SystemLoadRecord(
        String iso,
        Instant tsUtc,
        LocalDateTime tsLocal,
        String location,
        Double loadMw,
        boolean isSystem) implements LoadRecord {

    public SystemLoadRecord {
        Objects.requireNonNull(tsUtc, "tsUtc");
        Objects.requireNonNull(location, "location");
    }

    @Override
    public RecordKey identityKey() {
        return new RecordKey(tsUtc, location);
    }
}
