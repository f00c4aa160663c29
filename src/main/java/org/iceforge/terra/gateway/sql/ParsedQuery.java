package org.iceforge.terra.gateway.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A query request after validation and filter parsing, ready for SQL assembly.
 */
public record ParsedQuery(
        Identifier table,
        List<Identifier> select,
        List<Condition> where,
        List<Identifier> groupBy,
        Map<String, String> aggregations,
        List<Condition> having,
        List<OrderSpec> orderBy,
        int limit,
        int offset
) {
    public ParsedQuery {
        select = List.copyOf(select);
        where = List.copyOf(where);
        groupBy = List.copyOf(groupBy);
        aggregations = aggregations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(aggregations));
        having = List.copyOf(having);
        orderBy = List.copyOf(orderBy);
    }
}
