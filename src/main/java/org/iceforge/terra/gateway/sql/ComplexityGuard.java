package org.iceforge.terra.gateway.sql;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enforces size ceilings and validates every referenced identifier and filter value in one
 * pass, before any SQL is built. All violations are reported together.
 */
public class ComplexityGuard {

    private final int maxSelectColumns;
    private final int maxGroupByColumns;
    private final int maxFilters;
    private final int maxListItems;
    private final int maxStringLength;

    public ComplexityGuard(int maxSelectColumns, int maxGroupByColumns, int maxFilters,
                           int maxListItems, int maxStringLength) {
        this.maxSelectColumns = maxSelectColumns;
        this.maxGroupByColumns = maxGroupByColumns;
        this.maxFilters = maxFilters;
        this.maxListItems = maxListItems;
        this.maxStringLength = maxStringLength;
    }

    public static ComplexityGuard defaults() {
        return new ComplexityGuard(50, 50, 20, IdentifierValidator.MAX_LIST_ITEMS, IdentifierValidator.MAX_STRING_LENGTH);
    }

    public Result check(List<String> select, Map<String, Object> where, List<String> groupBy, String orderBy,
                        Map<String, String> aggregations, Map<String, Object> having) {
        List<String> issues = new ArrayList<>();
        select = select == null ? List.of() : select;
        groupBy = groupBy == null ? List.of() : groupBy;
        where = where == null ? Map.of() : where;
        aggregations = aggregations == null ? Map.of() : aggregations;
        having = having == null ? Map.of() : having;

        if (select.size() > maxSelectColumns) {
            issues.add("Too many columns in select (max " + maxSelectColumns + ")");
        }
        if (groupBy.size() > maxGroupByColumns) {
            issues.add("Too many group_by columns (max " + maxGroupByColumns + ")");
        }
        if (where.size() > maxFilters) {
            issues.add("Too many filters (max " + maxFilters + ")");
        }

        Set<String> referenced = new LinkedHashSet<>();
        referenced.addAll(select);
        referenced.addAll(groupBy);
        referenced.addAll(OrderSpec.columnNames(orderBy));
        referenced.addAll(where.keySet());
        referenced.addAll(aggregations.keySet());
        referenced.addAll(having.keySet());
        for (String col : referenced) {
            IdentifierValidator.ValidationResult r = IdentifierValidator.validateColumn(col);
            if (!r.ok()) {
                issues.add("Invalid column name '" + col + "': " + r.error());
            }
        }

        for (Map.Entry<String, Object> e : where.entrySet()) {
            checkValue(e.getKey(), e.getValue(), issues);
        }
        for (Map.Entry<String, Object> e : having.entrySet()) {
            checkValue(e.getKey(), e.getValue(), issues);
        }

        return new Result(issues, limits());
    }

    private void checkValue(String key, Object value, List<String> issues) {
        if (value instanceof Map<?, ?> ops) {
            for (Object v : ops.values()) {
                checkValue(key, v, issues);
            }
            return;
        }
        IdentifierValidator.ValidationResult r =
                IdentifierValidator.validateFilterValue(value, maxStringLength, maxListItems);
        if (!r.ok()) {
            issues.add("Invalid filter value for '" + key + "': " + r.error());
        }
    }

    public Map<String, Object> limits() {
        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("max_select_columns", maxSelectColumns);
        limits.put("max_group_by_columns", maxGroupByColumns);
        limits.put("max_filters", maxFilters);
        limits.put("max_list_items", maxListItems);
        limits.put("max_string_length", maxStringLength);
        return limits;
    }

    public record Result(List<String> violations, Map<String, Object> limits) {
        public Result {
            violations = List.copyOf(violations);
        }

        public boolean ok() {
            return violations.isEmpty();
        }

        public String message() {
            return String.join("; ", violations);
        }
    }
}
