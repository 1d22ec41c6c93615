package space.ketterling.gridload.normalize;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable two-way lookup between load zone ids and names.
 *
 * <p>
 * Names resolve case-insensitively. Aliases (the long names the feed uses in
 * location labels, e.g. {@code MAINE}) resolve to an id but never replace the
 * canonical name.
 * </p>
 */
public final class ZoneDirectory {
    private final Map<String, String> nameById;
    private final Map<String, String> idByName;

    private ZoneDirectory(Map<String, String> nameById, Map<String, String> aliases) {
        this.nameById = Map.copyOf(nameById);
        Map<String, String> rev = new HashMap<>();
        for (var e : aliases.entrySet())
            rev.put(e.getKey().toUpperCase(Locale.ROOT), e.getValue());
        for (var e : nameById.entrySet())
            rev.put(e.getValue().toUpperCase(Locale.ROOT), e.getKey());
        this.idByName = Map.copyOf(rev);
    }

    /**
     * Builds a directory from canonical id to name pairs plus optional aliases
     * (alias name to id).
     */
    public static ZoneDirectory of(Map<String, String> nameById, Map<String, String> aliases) {
        for (String id : aliases.values()) {
            if (!nameById.containsKey(id))
                throw new IllegalArgumentException("Alias points at unknown zone id " + id);
        }
        return new ZoneDirectory(nameById, aliases);
    }

    /**
     * The eight ISO-NE load zones plus the Hub (4000), which is not a load
     * zone but shows up in some payloads.
     */
    public static ZoneDirectory isoNewEngland() {
        Map<String, String> zones = new LinkedHashMap<>();
        zones.put("4000", "HUB");
        zones.put("4001", "ME");
        zones.put("4002", "NH");
        zones.put("4003", "VT");
        zones.put("4004", "CT");
        zones.put("4005", "RI");
        zones.put("4006", "SEMA");
        zones.put("4007", "WCMA");
        zones.put("4008", "NEMA/Boston");

        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("MAINE", "4001");
        aliases.put("NEWHAMPSHIRE", "4002");
        aliases.put("VERMONT", "4003");
        aliases.put("CONNECTICUT", "4004");
        aliases.put("RHODEISLAND", "4005");
        aliases.put("SEMASS", "4006");
        aliases.put("WCMASS", "4007");
        aliases.put("NEMASSBOST", "4008");
        aliases.put("NEMA", "4008");
        return of(zones, aliases);
    }

    public Optional<String> nameForId(String zoneId) {
        if (zoneId == null)
            return Optional.empty();
        return Optional.ofNullable(nameById.get(zoneId));
    }

    public Optional<String> idForName(String zoneName) {
        if (zoneName == null)
            return Optional.empty();
        return Optional.ofNullable(idByName.get(zoneName.trim().toUpperCase(Locale.ROOT)));
    }

    public int size() {
        return nameById.size();
    }
}
