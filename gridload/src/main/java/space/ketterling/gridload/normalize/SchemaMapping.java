package space.ketterling.gridload.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;

import space.ketterling.gridload.model.Dataset;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Versioned key-name table used to find fields in a feed payload.
 *
 * <p>
 * Every list is ordered by priority; the first key present with a non-empty
 * value wins. Tables live in {@code schema/<dataset>.json} on the classpath,
 * so an upstream field rename is a data edit.
 * </p>
 */
public record SchemaMapping(
        String dataset,
        int version,
        String fastPathKey,
        List<String> timeKeys,
        List<String> valueKeys,
        List<String> locationKeys,
        List<String> zoneIdKeys,
        List<String> zoneNameKeys,
        List<String> zoneIdHolderKeys,
        List<String> textHolderKeys,
        List<String> vendorPrefixes,
        String defaultLocation,
        List<String> systemLabels) {

    public SchemaMapping {
        timeKeys = copy(timeKeys);
        valueKeys = copy(valueKeys);
        locationKeys = copy(locationKeys);
        zoneIdKeys = copy(zoneIdKeys);
        zoneNameKeys = copy(zoneNameKeys);
        zoneIdHolderKeys = copy(zoneIdHolderKeys);
        textHolderKeys = copy(textHolderKeys);
        vendorPrefixes = copy(vendorPrefixes);
        systemLabels = copy(systemLabels);
        if (timeKeys.isEmpty() || valueKeys.isEmpty())
            throw new IllegalArgumentException("Schema mapping " + dataset + " needs time and value keys");
    }

    /**
     * Loads the bundled mapping for a dataset.
     */
    public static SchemaMapping load(ObjectMapper om, Dataset dataset) {
        String resource = "schema/" + dataset.tableName() + ".json";
        try (InputStream in = SchemaMapping.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalStateException("Missing schema mapping resource " + resource);
            return om.readValue(in, SchemaMapping.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable schema mapping " + resource, e);
        }
    }

    private static List<String> copy(List<String> keys) {
        return keys == null ? List.of() : List.copyOf(keys);
    }
}
