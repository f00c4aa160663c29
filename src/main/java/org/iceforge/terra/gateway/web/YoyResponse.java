package org.iceforge.terra.gateway.web;

import java.util.List;
import java.util.Map;

/**
 * @param rows one row per key: key, base, compare, delta (base - compare), pct (delta / base * 100)
 */
public record YoyResponse(List<Map<String, Object>> rows, int rowCount, int baseYear, int compareYear,
                          ResponseMeta meta) {
}
