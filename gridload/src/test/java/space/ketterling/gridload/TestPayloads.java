package space.ketterling.gridload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import space.ketterling.gridload.model.Dataset;
import space.ketterling.gridload.normalize.SchemaMapping;
import space.ketterling.gridload.normalize.SystemLoadNormalizer;
import space.ketterling.gridload.normalize.ZonalLoadNormalizer;
import space.ketterling.gridload.normalize.ZoneDirectory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Fixture payloads under {@code src/test/resources/payloads} plus the
 * normalizers wired the way the application wires them.
 */
public final class TestPayloads {
    public static final ObjectMapper OM = new ObjectMapper();

    private TestPayloads() {
    }

    public static byte[] bytes(String name) {
        String resource = "payloads/" + name;
        try (InputStream in = TestPayloads.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalStateException("Missing fixture " + resource);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode json(String name) {
        try {
            return OM.readTree(bytes(name));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SystemLoadNormalizer systemNormalizer() {
        return new SystemLoadNormalizer(SchemaMapping.load(OM, Dataset.SYSTEM), "ISONE");
    }

    public static ZonalLoadNormalizer zonalNormalizer() {
        return new ZonalLoadNormalizer(SchemaMapping.load(OM, Dataset.ZONAL), ZoneDirectory.isoNewEngland(), "ISONE");
    }
}
