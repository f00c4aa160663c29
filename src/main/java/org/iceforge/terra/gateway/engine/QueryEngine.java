package org.iceforge.terra.gateway.engine;

import java.util.List;
import java.util.Map;

/**
 * Runs a parameterized statement against the analytical store. Implementations block.
 */
public interface QueryEngine {

    /**
     * @param sql    statement text with {@code ?} placeholders
     * @param params one value per placeholder, in order
     * @return rows keyed by result column label, in column order
     */
    List<Map<String, Object>> execute(String sql, List<Object> params);
}
