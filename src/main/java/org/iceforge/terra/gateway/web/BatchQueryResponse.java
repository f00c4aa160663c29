package org.iceforge.terra.gateway.web;

import java.util.List;

public record BatchQueryResponse(List<Item> results) {

    /**
     * Exactly one of {@code data} and {@code error} is set.
     */
    public record Item(String status, QueryResponse data, ErrorResponse error) {

        public static Item success(QueryResponse data) {
            return new Item("success", data, null);
        }

        public static Item failure(ErrorResponse error) {
            return new Item("error", null, error);
        }
    }
}
