package org.iceforge.terra.gateway.entity;

import java.util.List;

/**
 * Outcome of resolving a free-text place name.
 *
 * @param canonicalName the stored spelling when matched, otherwise the input as given
 * @param level         level the name was matched at, or the level that was searched
 * @param matched       whether the name exists in the data
 * @param suggestions   close names, best first; empty when matched
 */
public record Resolution(String canonicalName, GeoLevel level, boolean matched, List<Suggestion> suggestions) {

    public Resolution {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static Resolution matched(String canonicalName, GeoLevel level) {
        return new Resolution(canonicalName, level, true, List.of());
    }

    public static Resolution unmatched(String name, GeoLevel level, List<Suggestion> suggestions) {
        return new Resolution(name, level, false, suggestions);
    }

    public List<String> suggestionNames() {
        return suggestions.stream().map(Suggestion::name).toList();
    }

    public record Suggestion(String name, GeoLevel level, double score) {
    }
}
