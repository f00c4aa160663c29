package org.iceforge.terra.gateway.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders parsed conditions into a parameterized {@code WHERE} or {@code HAVING} fragment.
 * Every literal becomes exactly one bound parameter.
 */
public final class ClauseBuilder {

    private ClauseBuilder() {
    }

    public static SqlFragment where(List<Condition> conditions) {
        return build("WHERE", conditions);
    }

    public static SqlFragment having(List<Condition> conditions) {
        return build("HAVING", conditions);
    }

    private static SqlFragment build(String keyword, List<Condition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return SqlFragment.EMPTY;
        }
        List<Object> params = new ArrayList<>();
        StringJoiner clauses = new StringJoiner(" AND ");
        for (Condition c : conditions) {
            clauses.add(render(c, params));
        }
        return new SqlFragment(keyword + " " + clauses, params);
    }

    static String render(Condition condition, List<Object> params) {
        String col = condition.column().quoted();
        Filter f = condition.filter();
        if (f instanceof Filter.Scalar s) {
            params.add(s.value());
            return col + " = ?";
        }
        if (f instanceof Filter.InSet in) {
            StringJoiner placeholders = new StringJoiner(", ", "(", ")");
            for (Object v : in.values()) {
                placeholders.add("?");
                params.add(v);
            }
            return col + " IN " + placeholders;
        }
        if (f instanceof Filter.Between b) {
            params.add(b.low());
            params.add(b.high());
            return col + " BETWEEN ? AND ?";
        }
        if (f instanceof Filter.Compare cmp) {
            params.add(cmp.value());
            return col + " " + cmp.op().sql() + " ?";
        }
        if (f instanceof Filter.Contains c) {
            params.add("%" + escapeLike(c.text()) + "%");
            return "CAST(" + col + " AS VARCHAR) LIKE ? ESCAPE '\\'";
        }
        throw new IllegalStateException("Unhandled filter type: " + f.getClass().getName());
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
