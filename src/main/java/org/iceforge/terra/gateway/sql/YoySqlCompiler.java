package org.iceforge.terra.gateway.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-year pivot self-join. Kept apart from {@link PushdownSqlCompiler} because the
 * CTE + join shape does not fit the generic clause template.
 */
public final class YoySqlCompiler {

    public static final Identifier YEAR = Identifier.column("year");

    private YoySqlCompiler() {
    }

    /**
     * @param filters user filters; any {@code year} condition is replaced by {@code year IN (base, compare)}
     * @param drop    {@code true} orders by delta descending (largest drop first)
     */
    public static PushdownSqlCompiler.CompiledQuery compile(Identifier table, Identifier keyCol, Identifier valueCol,
                                                            int baseYear, int compareYear, List<Condition> filters,
                                                            int topN, boolean drop) {
        List<Condition> conditions = new ArrayList<>();
        for (Condition c : filters) {
            if (!c.column().equals(YEAR)) {
                conditions.add(c);
            }
        }
        conditions.add(new Condition(YEAR, new Filter.InSet(List.of(baseYear, compareYear))));
        SqlFragment where = ClauseBuilder.where(conditions);

        String sql = "WITH t AS ("
                + "SELECT " + keyCol.quoted() + " AS k, CAST(" + YEAR.quoted() + " AS INT) AS y, SUM(" + valueCol.quoted() + ") AS v"
                + " FROM " + table.quoted()
                + " " + where.sql()
                + " GROUP BY " + keyCol.quoted() + ", CAST(" + YEAR.quoted() + " AS INT)"
                + ") "
                + "SELECT a.k AS \"key\", a.v AS \"base\", b.v AS \"compare\", (a.v - b.v) AS \"delta\", "
                + "CASE WHEN a.v <> 0 THEN (a.v - b.v) / a.v * 100.0 ELSE NULL END AS \"pct\" "
                + "FROM t a JOIN t b ON a.k = b.k AND a.y = ? AND b.y = ? "
                + "ORDER BY \"delta\" " + (drop ? "DESC" : "ASC")
                + " LIMIT " + topN;

        List<Object> params = new ArrayList<>(where.params());
        params.add(baseYear);
        params.add(compareYear);
        return new PushdownSqlCompiler.CompiledQuery(sql, params, List.of("key", "base", "compare", "delta", "pct"));
    }
}
