package org.iceforge.terra.gateway.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Geographic granularities, most specific first.
 */
public enum GeoLevel {
    CITY("city", "city_name"),
    ADMIN1("admin1", "admin1_name"),
    COUNTRY("country", "country_name");

    /**
     * Detection order on cross-level name collisions: most specific wins.
     */
    public static final List<GeoLevel> DETECTION_ORDER = List.of(CITY, ADMIN1, COUNTRY);

    private final String key;
    private final String column;

    GeoLevel(String key, String column) {
        this.key = key;
        this.column = column;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String column() {
        return column;
    }

    public static GeoLevel fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (GeoLevel level : values()) {
            if (level.key.equals(k) || level.column.equals(k)) {
                return level;
            }
        }
        // common synonyms
        return switch (k) {
            case "state", "province", "region" -> ADMIN1;
            default -> null;
        };
    }

    public static GeoLevel forColumn(String column) {
        for (GeoLevel level : values()) {
            if (level.column.equals(column)) {
                return level;
            }
        }
        return null;
    }
}
