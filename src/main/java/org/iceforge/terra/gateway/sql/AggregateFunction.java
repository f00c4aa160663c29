package org.iceforge.terra.gateway.sql;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum AggregateFunction {
    SUM("SUM(%s)", "sum", "sum"),
    AVG("AVG(%s)", "avg", "avg", "mean"),
    COUNT("COUNT(%s)", "count", "count"),
    DISTINCT("COUNT(DISTINCT %s)", "distinct_count", "distinct"),
    MIN("MIN(%s)", "min", "min"),
    MAX("MAX(%s)", "max", "max"),
    STDDEV("STDDEV_SAMP(%s)", "stddev", "std", "stddev"),
    VARIANCE("VAR_SAMP(%s)", "variance", "variance");

    private final String template;
    private final String suffix;
    private final List<String> names;

    AggregateFunction(String template, String suffix, String... names) {
        this.template = template;
        this.suffix = suffix;
        this.names = List.of(names);
    }

    public String render(Identifier column) {
        return String.format(template, column.quoted());
    }

    public Identifier alias(Identifier column) {
        return column.derive(suffix);
    }

    public static AggregateFunction fromName(String name) {
        if (name == null) {
            return null;
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (AggregateFunction f : values()) {
            if (f.names.contains(n)) {
                return f;
            }
        }
        return null;
    }

    public static List<String> allowedNames() {
        return Arrays.stream(values()).flatMap(f -> f.names.stream()).sorted().toList();
    }
}
