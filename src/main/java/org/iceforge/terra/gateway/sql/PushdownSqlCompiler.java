package org.iceforge.terra.gateway.sql;

import org.iceforge.terra.gateway.engine.ErrorCode;
import org.iceforge.terra.gateway.engine.QueryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assembles the generic pushdown statement:
 * {@code SELECT … FROM … WHERE … GROUP BY … HAVING … ORDER BY … LIMIT … OFFSET}.
 */
public final class PushdownSqlCompiler {

    private PushdownSqlCompiler() {
    }

    public static CompiledQuery compile(ParsedQuery q) {
        AggregationBuilder.Aggregation agg = AggregationBuilder.build(q.aggregations(), q.select(), q.groupBy());

        if (!q.having().isEmpty() && !agg.hasAggregates()) {
            throw QueryException.validation("having requires at least one aggregation");
        }

        List<Condition> having = new ArrayList<>();
        Set<Identifier> groupCols = Set.copyOf(q.groupBy());
        for (Condition c : q.having()) {
            Identifier target = agg.remap(c.column());
            if (!groupCols.contains(target) && !agg.isAlias(target)) {
                throw QueryException.builder(ErrorCode.VALIDATION_ERROR,
                                "having may only reference group_by columns or aggregate outputs, got '" + c.column() + "'")
                        .context("allowed", allowedHaving(q.groupBy(), agg))
                        .build();
            }
            having.add(new Condition(target, c.filter()));
        }

        List<OrderSpec> order = new ArrayList<>();
        for (OrderSpec o : q.orderBy()) {
            order.add(o.withColumn(agg.remap(o.column())));
        }

        SqlFragment where = ClauseBuilder.where(q.where());
        SqlFragment havingSql = ClauseBuilder.having(having);

        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(agg.selectExpressions().isEmpty() ? "*" : String.join(", ", agg.selectExpressions()));
        sql.append(" FROM ").append(q.table().quoted());
        if (!where.isEmpty()) {
            sql.append(' ').append(where.sql());
        }
        if (!q.groupBy().isEmpty()) {
            sql.append(" GROUP BY ").append(q.groupBy().stream().map(Identifier::quoted).collect(Collectors.joining(", ")));
        }
        if (!havingSql.isEmpty()) {
            sql.append(' ').append(havingSql.sql());
        }
        if (!order.isEmpty()) {
            sql.append(" ORDER BY ").append(order.stream().map(OrderSpec::render).collect(Collectors.joining(", ")));
        }
        sql.append(" LIMIT ").append(q.limit());
        if (q.offset() > 0) {
            sql.append(" OFFSET ").append(q.offset());
        }

        List<Object> params = new ArrayList<>(where.params());
        params.addAll(havingSql.params());
        return new CompiledQuery(sql.toString(), params, agg.outputColumns());
    }

    private static List<String> allowedHaving(List<Identifier> groupBy, AggregationBuilder.Aggregation agg) {
        List<String> allowed = new ArrayList<>();
        groupBy.forEach(g -> allowed.add(g.name()));
        agg.aliases().values().forEach(a -> allowed.add(a.name()));
        return allowed;
    }

    /**
     * @param outputColumns columns the request asked for; informational only, rows are keyed by
     *                      the engine's own result metadata
     */
    public record CompiledQuery(String sql, List<Object> params, List<String> outputColumns) {
        public CompiledQuery {
            params = List.copyOf(params);
            outputColumns = List.copyOf(outputColumns);
        }
    }
}
