package space.ketterling.gridload.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.SystemLoadRecord;
import space.ketterling.gridload.model.TimestampParser;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Normalizer for the five-minute system load feed.
 *
 * <p>
 * The usual payload is {@code {"FiveMinSystemLoad": [{"BeginDate": ...,
 * "LoadMw": ...}, ...]}}; that layout is read directly and every row is
 * tagged as the system total. Anything else goes through the generic walk,
 * where the location comes from the payload or defaults to the system label.
 * </p>
 */
public final class SystemLoadNormalizer extends PayloadNormalizer<SystemLoadRecord> {
    private static final Comparator<SystemLoadRecord> ORDER = Comparator
            .comparing(SystemLoadRecord::tsUtc)
            .thenComparing(SystemLoadRecord::location, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Set<String> systemLabels;
    private final String defaultLocation;

    public SystemLoadNormalizer(SchemaMapping mapping, String iso) {
        super(Dataset.SYSTEM, mapping, iso);
        this.systemLabels = mapping.systemLabels().stream()
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.defaultLocation = mapping.defaultLocation() == null ? iso : mapping.defaultLocation();
    }

    @Override
    protected void readFastPath(JsonNode payload, Sink<SystemLoadRecord> sink) {
        if (mapping.fastPathKey() == null || !payload.isObject())
            return;
        JsonNode rows = payload.get(mapping.fastPathKey());
        if (rows == null || !rows.isArray())
            return;
        for (JsonNode row : rows) {
            if (!row.isObject())
                continue;
            JsonNode t = JsonFields.firstHit(row, mapping.timeKeys());
            JsonNode v = JsonFields.firstHit(row, mapping.valueKeys());
            if (t == null || v == null)
                continue;
            Optional<TimestampParser.Parsed> ts = readTime(row, t, sink);
            if (ts.isEmpty())
                continue;
            sink.emit(new SystemLoadRecord(iso, ts.get().utc(), ts.get().local(), defaultLocation,
                    readLoad(v, sink), true));
        }
    }

    @Override
    protected void visitObject(JsonNode node, Sink<SystemLoadRecord> sink) {
        JsonNode t = JsonFields.firstHit(node, mapping.timeKeys());
        JsonNode v = JsonFields.firstHit(node, mapping.valueKeys());
        if (t == null || v == null)
            return;
        Optional<TimestampParser.Parsed> ts = readTime(node, t, sink);
        if (ts.isEmpty())
            return;

        String location = JsonFields.extractText(JsonFields.firstHit(node, mapping.locationKeys()),
                mapping.textHolderKeys());
        if (location == null)
            location = defaultLocation;

        sink.emit(new SystemLoadRecord(iso, ts.get().utc(), ts.get().local(), location,
                readLoad(v, sink), isSystemLabel(location)));
    }

    /**
     * True when the location names the whole system rather than a sub-area.
     */
    public boolean isSystemLabel(String location) {
        return location != null && systemLabels.contains(location.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    protected Comparator<SystemLoadRecord> ordering() {
        return ORDER;
    }
}
