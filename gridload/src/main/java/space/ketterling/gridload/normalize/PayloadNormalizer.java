package space.ketterling.gridload.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.model.LoadRecord;
import space.ketterling.gridload.model.TimestampParser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a raw feed payload into canonical records for one dataset.
 *
 * <p>
 * The payload tree is walked depth-first; every object node is offered to
 * {@link #visitObject}, which may emit a record, and traversal continues into
 * all children regardless. Subclasses may read a known layout directly via
 * {@link #readFastPath} before the walk runs.
 * </p>
 *
 * <p>
 * Instances are stateless and safe to share.
 * </p>
 */
public abstract class PayloadNormalizer<R extends LoadRecord> {
    protected final Dataset dataset;
    protected final SchemaMapping mapping;
    protected final String iso;

    protected PayloadNormalizer(Dataset dataset, SchemaMapping mapping, String iso) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.iso = Objects.requireNonNull(iso, "iso");
    }

    public Dataset dataset() {
        return dataset;
    }

    public SchemaMapping mapping() {
        return mapping;
    }

    /**
     * Normalizes one payload.
     *
     * @throws UnexpectedShapeException when no record can be extracted
     */
    public final NormalizedBatch<R> normalize(JsonNode payload) {
        Sink<R> sink = new Sink<>();
        if (payload != null) {
            readFastPath(payload, sink);
            if (sink.records.isEmpty()) {
                sink = new Sink<>();
                walk(payload, sink);
            }
        }
        if (sink.records.isEmpty()) {
            throw new UnexpectedShapeException(dataset, payload,
                    "No " + dataset.tableName() + " records found in payload ("
                            + sink.rejected.size() + " rejected)");
        }
        sink.records.sort(ordering());
        return new NormalizedBatch<>(dataset, sink.records, sink.warnings, sink.rejected);
    }

    /**
     * Reads a well-known payload layout without a full walk. The default does
     * nothing.
     */
    protected void readFastPath(JsonNode payload, Sink<R> sink) {
    }

    /**
     * Examines one object node and emits at most one record or rejection.
     */
    protected abstract void visitObject(JsonNode node, Sink<R> sink);

    /** Output order of a batch. */
    protected abstract Comparator<R> ordering();

    private void walk(JsonNode node, Sink<R> sink) {
        switch (node.getNodeType()) {
            case OBJECT -> {
                visitObject(node, sink);
                Iterator<JsonNode> it = node.elements();
                while (it.hasNext())
                    walk(it.next(), sink);
            }
            case ARRAY -> {
                for (JsonNode child : node)
                    walk(child, sink);
            }
            default -> {
                // scalars carry no records
            }
        }
    }

    /**
     * Parses the time field of a node, rejecting the node when it cannot be
     * read.
     */
    protected Optional<TimestampParser.Parsed> readTime(JsonNode node, JsonNode rawTime, Sink<R> sink) {
        String text = JsonFields.extractText(rawTime, mapping.textHolderKeys());
        Optional<TimestampParser.Parsed> parsed = TimestampParser.parse(text);
        if (parsed.isEmpty()) {
            sink.warn(new CoercionWarning(dataset, "ts_utc", text, "unparseable timestamp, record rejected"));
            sink.reject(node);
        }
        return parsed;
    }

    /**
     * Coerces a load value to a finite double; null plus a warning otherwise.
     */
    protected Double readLoad(JsonNode rawValue, Sink<R> sink) {
        if (rawValue.isNumber()) {
            double d = rawValue.doubleValue();
            if (Double.isFinite(d))
                return d;
        } else {
            String text = rawValue.isTextual() ? rawValue.asText().trim()
                    : JsonFields.extractText(rawValue, mapping.textHolderKeys());
            Double d = parseFinite(text);
            if (d != null)
                return d;
        }
        sink.warn(new CoercionWarning(dataset, "load_mw", rawValue.isTextual() ? rawValue.asText()
                : rawValue.toString(), "not a finite number, stored as null"));
        return null;
    }

    private static Double parseFinite(String text) {
        if (text == null || text.isEmpty())
            return null;
        try {
            double d = Double.parseDouble(text);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Accumulates the output of one normalization.
     */
    protected static final class Sink<R> {
        private final List<R> records = new ArrayList<>();
        private final List<CoercionWarning> warnings = new ArrayList<>();
        private final List<JsonNode> rejected = new ArrayList<>();

        public void emit(R record) {
            records.add(record);
        }

        public void warn(CoercionWarning warning) {
            warnings.add(warning);
        }

        public void reject(JsonNode node) {
            rejected.add(node.deepCopy());
        }

        public int emitted() {
            return records.size();
        }
    }
}
