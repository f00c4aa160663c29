package org.iceforge.terra.gateway.sql;

import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the loosely typed JSON {@code where}/{@code having} maps into {@link Condition}s.
 * This is the only place that looks at operator keys; everything downstream works on {@link Filter}.
 */
public class FilterParser {

    static final List<String> OPERATORS = List.of("in", "between", "gte", "lte", "gt", "lt", "contains");

    private final int maxStringLength;
    private final int maxListItems;

    public FilterParser() {
        this(IdentifierValidator.MAX_STRING_LENGTH, IdentifierValidator.MAX_LIST_ITEMS);
    }

    public FilterParser(int maxStringLength, int maxListItems) {
        this.maxStringLength = maxStringLength;
        this.maxListItems = maxListItems;
    }

    public List<Condition> parse(Map<String, Object> filters, String clause) {
        List<Condition> out = new ArrayList<>();
        if (filters == null) {
            return out;
        }
        for (Map.Entry<String, Object> e : filters.entrySet()) {
            Identifier column = Identifier.column(e.getKey());
            Object raw = e.getValue();
            if (raw instanceof Map<?, ?> ops) {
                if (ops.isEmpty()) {
                    throw QueryException.validation(clause + " filter for '" + column + "' has no operator");
                }
                for (Map.Entry<?, ?> op : ops.entrySet()) {
                    out.add(new Condition(column, parseOperator(clause, column, String.valueOf(op.getKey()), op.getValue())));
                }
            } else if (raw instanceof List<?> list) {
                // bare list is shorthand for {in: [...]}
                if (list.isEmpty()) {
                    throw invalid(clause, column, "'in' list must not be empty");
                }
                out.add(new Condition(column, new Filter.InSet(scalarList(clause, column, list))));
            } else {
                out.add(new Condition(column, new Filter.Scalar(scalar(clause, column, raw))));
            }
        }
        return out;
    }

    private Filter parseOperator(String clause, Identifier column, String key, Object value) {
        String op = key.toLowerCase(Locale.ROOT);
        switch (op) {
            case "in" -> {
                if (!(value instanceof List<?> list)) {
                    throw invalid(clause, column, "'in' expects a list");
                }
                if (list.isEmpty()) {
                    throw invalid(clause, column, "'in' list must not be empty");
                }
                return new Filter.InSet(scalarList(clause, column, list));
            }
            case "between" -> {
                if (!(value instanceof List<?> list) || list.size() != 2) {
                    throw invalid(clause, column, "'between' expects exactly two values [low, high]");
                }
                List<Object> bounds = scalarList(clause, column, list);
                return new Filter.Between(bounds.get(0), bounds.get(1));
            }
            case "contains" -> {
                Object text = scalar(clause, column, value);
                return new Filter.Contains(String.valueOf(text));
            }
            default -> {
                Filter.Op cmp = Filter.Op.fromKey(op);
                if (cmp == null) {
                    throw QueryException.builder(ErrorCode.VALIDATION_ERROR,
                                    "Unknown " + clause + " operator '" + key + "' for column '" + column + "'")
                            .hint("Allowed operators: " + String.join(", ", OPERATORS))
                            .context("allowed_operators", OPERATORS)
                            .build();
                }
                return new Filter.Compare(cmp, scalar(clause, column, value));
            }
        }
    }

    private List<Object> scalarList(String clause, Identifier column, List<?> list) {
        check(clause, column, list);
        List<Object> values = new ArrayList<>(list.size());
        for (Object item : list) {
            values.add(scalar(clause, column, item));
        }
        return values;
    }

    private Object scalar(String clause, Identifier column, Object value) {
        if (value == null) {
            throw invalid(clause, column, "null values are not supported");
        }
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw invalid(clause, column, "expected a string, number or boolean but got " + value.getClass().getSimpleName());
        }
        check(clause, column, value);
        return value;
    }

    private void check(String clause, Identifier column, Object value) {
        IdentifierValidator.ValidationResult r =
                IdentifierValidator.validateFilterValue(value, maxStringLength, maxListItems);
        if (!r.ok()) {
            throw invalid(clause, column, r.error());
        }
    }

    private static QueryException invalid(String clause, Identifier column, String message) {
        return QueryException.validation("Invalid " + clause + " value for '" + column + "': " + message);
    }
}
