package org.iceforge.terra.gateway.sql;

import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a column → function map into aliased aggregate expressions and merges them with the
 * plain select / group-by columns.
 */
public final class AggregationBuilder {

    private AggregationBuilder() {
    }

    public static Aggregation build(Map<String, String> aggregations, List<Identifier> select, List<Identifier> groupBy) {
        Map<Identifier, Identifier> aliases = new LinkedHashMap<>();
        List<String> aggregateExprs = new ArrayList<>();

        if (aggregations != null) {
            for (Map.Entry<String, String> e : aggregations.entrySet()) {
                Identifier column = Identifier.column(e.getKey());
                AggregateFunction fn = AggregateFunction.fromName(e.getValue());
                if (fn == null) {
                    List<String> allowed = AggregateFunction.allowedNames();
                    throw QueryException.builder(ErrorCode.VALIDATION_ERROR,
                                    "Invalid aggregation function: " + e.getValue() + ". Allowed: " + String.join(", ", allowed))
                            .context("allowed_functions", allowed)
                            .build();
                }
                Identifier alias = fn.alias(column);
                aliases.put(column, alias);
                aggregateExprs.add(fn.render(column) + " AS " + alias.quoted());
            }
        }

        // group-by first, then select; columns that are aggregated are not repeated raw
        Set<Identifier> plain = new LinkedHashSet<>();
        for (Identifier g : groupBy) {
            plain.add(g);
        }
        for (Identifier s : select) {
            if (!aliases.containsKey(s)) {
                plain.add(s);
            }
        }

        List<String> expressions = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        for (Identifier p : plain) {
            expressions.add(p.quoted());
            outputs.add(p.name());
        }
        expressions.addAll(aggregateExprs);
        for (Identifier alias : aliases.values()) {
            outputs.add(alias.name());
        }
        return new Aggregation(expressions, outputs, aliases);
    }

    /**
     * @param selectExpressions rendered select-list items, plain columns first
     * @param outputColumns     result column names in select order
     * @param aliases           original column → generated alias
     */
    public record Aggregation(List<String> selectExpressions, List<String> outputColumns,
                              Map<Identifier, Identifier> aliases) {

        public Aggregation {
            selectExpressions = List.copyOf(selectExpressions);
            outputColumns = List.copyOf(outputColumns);
            aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        }

        public boolean hasAggregates() {
            return !aliases.isEmpty();
        }

        /**
         * Maps an original aggregated column onto its alias; anything else is returned as is.
         */
        public Identifier remap(Identifier reference) {
            return aliases.getOrDefault(reference, reference);
        }

        public boolean isAlias(Identifier reference) {
            return aliases.containsValue(reference);
        }
    }
}
