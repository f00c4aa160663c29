package org.iceforge.terra.gateway.entity;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-level alias → canonical name lookup, case-insensitive.
 */
public class AliasTable {

    private static final List<GeoLevel> LOOKUP_ORDER = List.of(GeoLevel.COUNTRY, GeoLevel.ADMIN1, GeoLevel.CITY);

    private final Map<GeoLevel, Map<String, String>> byLevel = new EnumMap<>(GeoLevel.class);

    /**
     * @param raw level key ({@code country}, {@code admin1}, {@code city}) → alias → canonical name
     */
    public AliasTable(Map<String, Map<String, String>> raw) {
        for (GeoLevel level : GeoLevel.values()) {
            byLevel.put(level, new HashMap<>());
        }
        if (raw == null) {
            return;
        }
        raw.forEach((key, aliases) -> {
            GeoLevel level = GeoLevel.fromKey(key);
            if (level == null) {
                throw new IllegalArgumentException("Unknown alias level '" + key + "'");
            }
            if (aliases != null) {
                aliases.forEach((alias, canonical) -> byLevel.get(level).put(normalize(alias), canonical));
            }
        });
    }

    public static AliasTable empty() {
        return new AliasTable(Map.of());
    }

    /**
     * Looks the name up at {@code preferred} first, then country, admin1 and city.
     *
     * @return the canonical name and its level, or {@code null} when no table knows the name
     */
    public Hit lookup(String name, GeoLevel preferred) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String key = normalize(name);
        if (preferred != null) {
            String canonical = byLevel.get(preferred).get(key);
            if (canonical != null) {
                return new Hit(canonical, preferred);
            }
        }
        for (GeoLevel level : LOOKUP_ORDER) {
            if (level == preferred) {
                continue;
            }
            String canonical = byLevel.get(level).get(key);
            if (canonical != null) {
                return new Hit(canonical, level);
            }
        }
        return null;
    }

    public int size(GeoLevel level) {
        return byLevel.get(level).size();
    }

    private static String normalize(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }

    public record Hit(String canonicalName, GeoLevel level) {
    }
}
