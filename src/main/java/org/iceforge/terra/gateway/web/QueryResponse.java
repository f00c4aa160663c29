package org.iceforge.terra.gateway.web;

import java.util.List;
import java.util.Map;

public record QueryResponse(List<Map<String, Object>> rows, int rowCount, ResponseMeta meta) {
}
