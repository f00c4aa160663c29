package org.iceforge.terra.gateway.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Builds cache keys of the form {@code operation:<canonical JSON>}. Map entries and bean
 * properties are sorted so equal requests produce equal keys.
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private CacheKeys() {
    }

    public static String of(String operation, Object args) {
        try {
            return operation + ":" + CANONICAL.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot build cache key for " + operation, e);
        }
    }
}
