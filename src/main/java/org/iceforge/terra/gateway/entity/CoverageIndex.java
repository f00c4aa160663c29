package org.iceforge.terra.gateway.entity;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Names known to exist in the data at each geographic level. Immutable once built.
 */
public final class CoverageIndex {

    private final Map<GeoLevel, SortedSet<String>> names;
    private final Map<GeoLevel, Map<String, String>> lowerToCanonical;

    private CoverageIndex(Map<GeoLevel, SortedSet<String>> names) {
        this.names = new EnumMap<>(GeoLevel.class);
        this.lowerToCanonical = new EnumMap<>(GeoLevel.class);
        for (GeoLevel level : GeoLevel.values()) {
            SortedSet<String> set = names.getOrDefault(level, new TreeSet<>());
            this.names.put(level, Collections.unmodifiableSortedSet(new TreeSet<>(set)));
            Map<String, String> lower = new HashMap<>();
            for (String n : set) {
                lower.putIfAbsent(n.toLowerCase(Locale.ROOT), n);
            }
            this.lowerToCanonical.put(level, lower);
        }
    }

    public static CoverageIndex empty() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public SortedSet<String> names(GeoLevel level) {
        return names.get(level);
    }

    public boolean containsExact(GeoLevel level, String name) {
        return name != null && names.get(level).contains(name);
    }

    /**
     * @return the stored spelling of {@code name} at {@code level}, or {@code null}
     */
    public String findIgnoreCase(GeoLevel level, String name) {
        if (name == null) {
            return null;
        }
        return lowerToCanonical.get(level).get(name.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isEmpty() {
        return names.values().stream().allMatch(Collection::isEmpty);
    }

    /**
     * Level key → sorted names, for serialization.
     */
    public Map<String, List<String>> asMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (GeoLevel level : List.of(GeoLevel.COUNTRY, GeoLevel.ADMIN1, GeoLevel.CITY)) {
            out.put(level.key(), List.copyOf(names.get(level)));
        }
        return out;
    }

    public static final class Builder {
        private final Map<GeoLevel, SortedSet<String>> names = new EnumMap<>(GeoLevel.class);

        private Builder() {
        }

        public Builder add(GeoLevel level, Collection<String> values) {
            SortedSet<String> set = names.computeIfAbsent(level, l -> new TreeSet<>());
            for (String v : values) {
                if (v != null && !v.isBlank()) {
                    set.add(v);
                }
            }
            return this;
        }

        public Builder add(GeoLevel level, String... values) {
            return add(level, List.of(values));
        }

        public CoverageIndex build() {
            return new CoverageIndex(names);
        }
    }
}
