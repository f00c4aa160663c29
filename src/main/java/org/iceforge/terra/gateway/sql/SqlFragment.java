package org.iceforge.terra.gateway.sql;

import java.util.List;

/**
 * A piece of SQL text and the values bound to its {@code ?} placeholders, in order.
 */
public record SqlFragment(String sql, List<Object> params) {

    public static final SqlFragment EMPTY = new SqlFragment("", List.of());

    public SqlFragment {
        params = List.copyOf(params);
    }

    public boolean isEmpty() {
        return sql.isEmpty();
    }
}
