package org.iceforge.terra.gateway.entity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Maps free-text place names onto the spellings stored in the data.
 *
 * <p>Order of attempts: alias tables, exact / case-insensitive lookup in the coverage index,
 * fuzzy match at the target level, then fuzzy match across all levels. Never throws.
 */
public class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    public static final GeoLevel DEFAULT_LEVEL = GeoLevel.COUNTRY;

    private static final Comparator<Resolution.Suggestion> RANKING =
            Comparator.comparingDouble(Resolution.Suggestion::score).reversed()
                    .thenComparing(Resolution.Suggestion::name);

    private final AliasTable aliases;
    private final Supplier<CoverageIndex> coverage;
    private final SimilarityScorer scorer;
    private final double threshold;
    private final int maxSuggestions;

    public EntityResolver(AliasTable aliases, Supplier<CoverageIndex> coverage, SimilarityScorer scorer,
                          double threshold, int maxSuggestions) {
        this.aliases = Objects.requireNonNull(aliases);
        this.coverage = Objects.requireNonNull(coverage);
        this.scorer = Objects.requireNonNull(scorer);
        this.threshold = threshold;
        this.maxSuggestions = maxSuggestions;
    }

    public Resolution resolve(String name) {
        return resolve(name, null);
    }

    public Resolution resolve(String name, GeoLevel level) {
        GeoLevel fallbackLevel = level == null ? DEFAULT_LEVEL : level;
        if (name == null || name.isBlank()) {
            return Resolution.unmatched(name, fallbackLevel, List.of());
        }
        try {
            return doResolve(name.trim(), level);
        } catch (RuntimeException e) {
            log.warn("Entity resolution failed for '{}' at level {}: {}", name, fallbackLevel, e.toString());
            return Resolution.unmatched(name, fallbackLevel, List.of());
        }
    }

    private Resolution doResolve(String name, GeoLevel hint) {
        String candidate = name;
        GeoLevel level = hint;
        AliasTable.Hit alias = aliases.lookup(name, hint);
        if (alias != null) {
            candidate = alias.canonicalName();
            if (level == null) {
                level = alias.level();
            }
        }

        CoverageIndex index = coverage.get();
        List<GeoLevel> levels = level == null ? GeoLevel.DETECTION_ORDER : List.of(level);

        for (GeoLevel l : levels) {
            if (index.containsExact(l, candidate)) {
                return Resolution.matched(candidate, l);
            }
        }
        for (GeoLevel l : levels) {
            String stored = index.findIgnoreCase(l, candidate);
            if (stored != null) {
                return Resolution.matched(stored, l);
            }
        }

        GeoLevel target = level == null ? DEFAULT_LEVEL : level;
        if (alias != null && index.names(target).isEmpty()) {
            // nothing to check the alias against
            return Resolution.matched(candidate, target);
        }

        List<Resolution.Suggestion> atTarget = suggest(index, candidate, List.of(target));
        if (!atTarget.isEmpty()) {
            return Resolution.unmatched(name, target, atTarget);
        }
        return Resolution.unmatched(name, target, suggest(index, candidate, GeoLevel.DETECTION_ORDER));
    }

    /**
     * Scores every known name at the given levels and keeps the best ones above the threshold.
     */
    public List<Resolution.Suggestion> suggest(CoverageIndex index, String name, List<GeoLevel> levels) {
        List<Resolution.Suggestion> scored = new ArrayList<>();
        for (GeoLevel l : levels) {
            for (String known : index.names(l)) {
                double s = scorer.score(name, known);
                if (s >= threshold) {
                    scored.add(new Resolution.Suggestion(known, l, s));
                }
            }
        }
        scored.sort(RANKING);
        return scored.size() > maxSuggestions ? List.copyOf(scored.subList(0, maxSuggestions)) : scored;
    }

    public List<String> rank(String name, Iterable<String> candidates) {
        return rank(name, candidates, threshold);
    }

    /**
     * Ranks arbitrary candidate strings against {@code name}, best first.
     */
    public List<String> rank(String name, Iterable<String> candidates, double minScore) {
        List<Resolution.Suggestion> scored = new ArrayList<>();
        for (String c : candidates) {
            double s = scorer.score(name, c);
            if (s >= minScore) {
                scored.add(new Resolution.Suggestion(c, null, s));
            }
        }
        scored.sort(RANKING);
        return scored.stream().limit(maxSuggestions).map(Resolution.Suggestion::name).toList();
    }
}
