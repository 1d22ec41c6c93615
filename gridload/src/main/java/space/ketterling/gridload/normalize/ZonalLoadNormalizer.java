package space.ketterling.gridload.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.TimestampParser;
import space.ketterling.gridload.model.ZonalLoadRecord;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalizer for the five-minute estimated zonal load feed.
 *
 * <p>
 * A node becomes a record when it has a time, a value and at least one of a
 * zone id or zone name. Whichever side is missing is filled from the
 * {@link ZoneDirectory}; an id the directory does not know is used as its own
 * name.
 * </p>
 */
public final class ZonalLoadNormalizer extends PayloadNormalizer<ZonalLoadRecord> {
    private static final Comparator<ZonalLoadRecord> ORDER = Comparator
            .comparing(ZonalLoadRecord::tsUtc)
            .thenComparing(ZonalLoadRecord::zoneId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ZonalLoadRecord::zoneName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ZoneDirectory zones;

    public ZonalLoadNormalizer(SchemaMapping mapping, ZoneDirectory zones, String iso) {
        super(Dataset.ZONAL, mapping, iso);
        this.zones = Objects.requireNonNull(zones, "zones");
    }

    @Override
    protected void visitObject(JsonNode node, Sink<ZonalLoadRecord> sink) {
        JsonNode t = JsonFields.firstHit(node, mapping.timeKeys());
        JsonNode v = JsonFields.firstHit(node, mapping.valueKeys());
        JsonNode rawId = JsonFields.firstHit(node, mapping.zoneIdKeys());
        JsonNode rawName = JsonFields.firstHit(node, mapping.zoneNameKeys());
        if (t == null || v == null || (rawId == null && rawName == null))
            return;

        String zoneId = readZoneId(rawId);
        String zoneName = rawName != null ? cleanName(JsonFields.extractText(rawName, mapping.textHolderKeys())) : null;

        // The id field may carry the name instead, e.g. {"@LocId": "4001", "$": ".Z.MAINE"} or ".Z.MAINE".
        if (zoneName == null && rawId != null)
            zoneName = nameFromIdField(rawId, zoneId);

        // Likewise a wrapped name such as "Location": {"$": ".Z.MAINE", "@LocId": "4001"} can carry the id.
        if (zoneId == null && rawName != null && rawName.isObject())
            zoneId = JsonFields.canonicalId(JsonFields.firstHit(rawName, mapping.zoneIdHolderKeys()));

        if (zoneId == null && zoneName != null)
            zoneId = zones.idForName(zoneName).orElse(null);
        if (zoneName == null && zoneId != null)
            zoneName = zones.nameForId(zoneId).orElse(zoneId);

        if (zoneId == null && zoneName == null) {
            sink.warn(new CoercionWarning(dataset, "zone_id", rawId == null ? null : rawId.toString(),
                    "no usable zone id or name, record rejected"));
            sink.reject(node);
            return;
        }

        Optional<TimestampParser.Parsed> ts = readTime(node, t, sink);
        if (ts.isEmpty())
            return;

        sink.emit(new ZonalLoadRecord(iso, ts.get().utc(), ts.get().local(), zoneId, zoneName,
                readLoad(v, sink)));
    }

    private String readZoneId(JsonNode rawId) {
        if (rawId == null)
            return null;
        if (rawId.isObject()) {
            JsonNode held = JsonFields.firstHit(rawId, mapping.zoneIdHolderKeys());
            if (held != null)
                return JsonFields.canonicalId(held);
            return JsonFields.canonicalId(JsonFields.extractText(rawId, mapping.textHolderKeys()));
        }
        return JsonFields.canonicalId(rawId);
    }

    private String nameFromIdField(JsonNode rawId, String zoneId) {
        if (rawId.isNumber())
            return null;
        String text = cleanName(JsonFields.extractText(rawId, mapping.textHolderKeys()));
        if (text == null || text.equals(zoneId) || JsonFields.canonicalId(text) != null)
            return null;
        return text;
    }

    /**
     * Strips vendor prefixes like {@code .Z.} and surrounding whitespace.
     */
    String cleanName(String name) {
        if (name == null)
            return null;
        String s = name.trim();
        for (String prefix : mapping.vendorPrefixes()) {
            if (s.startsWith(prefix)) {
                s = s.substring(prefix.length()).trim();
                break;
            }
        }
        return s.isEmpty() ? null : s;
    }

    public ZoneDirectory zones() {
        return zones;
    }

    @Override
    protected Comparator<ZonalLoadRecord> ordering() {
        return ORDER;
    }
}
