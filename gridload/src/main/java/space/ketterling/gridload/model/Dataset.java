package space.ketterling.gridload.model;

import java.util.Locale;

/**
 * The two load datasets published by the feed.
 *
 * <p>
 * {@link #tableName()} is the stable name used for history partitions,
 * warehouse segments and query views.
 * </p>
 */
public enum Dataset {
    SYSTEM("system_load", "system"),
    ZONAL("zonal_load", "zonal");

    private final String tableName;
    private final String shortName;

    Dataset(String tableName, String shortName) {
        this.tableName = tableName;
        this.shortName = shortName;
    }

    public String tableName() {
        return tableName;
    }

    public String shortName() {
        return shortName;
    }

    /**
     * Resolves "system" / "zonal" (or the table name) to a dataset.
     */
    public static Dataset fromName(String name) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Dataset name is required");
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (Dataset d : values()) {
            if (d.shortName.equals(n) || d.tableName.equals(n))
                return d;
        }
        throw new IllegalArgumentException("Unknown dataset: " + name + " (expected system or zonal)");
    }
}
