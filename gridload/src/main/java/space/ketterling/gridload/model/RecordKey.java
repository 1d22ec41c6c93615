package space.ketterling.gridload.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Natural identity of a load row within one day: the UTC timestamp plus the
 * dataset-specific location or zone identity.
 */
public record RecordKey(Instant tsUtc, String id) implements Comparable<RecordKey> {

    private static final Comparator<RecordKey> ORDER = Comparator
            .comparing(RecordKey::tsUtc)
            .thenComparing(RecordKey::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public RecordKey {
        Objects.requireNonNull(tsUtc, "tsUtc");
    }

    @Override
    public int compareTo(RecordKey o) {
        return ORDER.compare(this, o);
    }
}
