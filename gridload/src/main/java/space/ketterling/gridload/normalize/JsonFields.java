package space.ketterling.gridload.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Small helpers for reading loosely shaped JSON objects.
 */
final class JsonFields {
    private static final Pattern INTEGRAL_TEXT = Pattern.compile("\\d+(\\.0+)?");

    private JsonFields() {
    }

    /**
     * First key of {@code keys} present on {@code obj} with a value that is
     * neither null nor the empty string, or null.
     */
    static JsonNode firstHit(JsonNode obj, List<String> keys) {
        for (String k : keys) {
            JsonNode v = obj.get(k);
            if (isPresent(v))
                return v;
        }
        return null;
    }

    static boolean isPresent(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode())
            return false;
        return !(v.isTextual() && v.asText().isEmpty());
    }

    /**
     * Reads a label out of a scalar or a wrapper object such as
     * {@code {"$": "ISONE"}}. Holder keys are tried first, then any string
     * member, then the node's JSON text.
     */
    static String extractText(JsonNode v, List<String> holderKeys) {
        if (v == null || v.isNull() || v.isMissingNode())
            return null;
        if (v.isTextual()) {
            String s = v.asText().trim();
            return s.isEmpty() ? null : s;
        }
        if (v.isIntegralNumber())
            return v.asText();
        if (v.isNumber())
            return integralText(v.doubleValue());
        if (v.isObject()) {
            for (String k : holderKeys) {
                JsonNode h = v.get(k);
                if (h == null)
                    continue;
                if (h.isTextual() && !h.asText().isBlank())
                    return h.asText().trim();
                if (h.isNumber())
                    return h.isIntegralNumber() ? h.asText() : integralText(h.doubleValue());
            }
            Iterator<Map.Entry<String, JsonNode>> it = v.fields();
            while (it.hasNext()) {
                JsonNode m = it.next().getValue();
                if (m.isTextual() && !m.asText().isBlank())
                    return m.asText().trim();
            }
        }
        return v.toString();
    }

    /**
     * Canonical integer text for id-like values ("4004", 4004, 4004.0,
     * "4004.0"); null for anything else.
     */
    static String canonicalId(JsonNode v) {
        if (v == null)
            return null;
        if (v.isIntegralNumber())
            return v.bigIntegerValue().toString();
        if (v.isNumber()) {
            double d = v.doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d) ? integralText(d) : null;
        }
        if (v.isTextual())
            return canonicalId(v.asText());
        return null;
    }

    static String canonicalId(String s) {
        if (s == null)
            return null;
        String t = s.trim();
        if (!INTEGRAL_TEXT.matcher(t).matches())
            return null;
        int dot = t.indexOf('.');
        return dot < 0 ? t : t.substring(0, dot);
    }

    private static String integralText(double d) {
        return Long.toString((long) d);
    }
}
