package org.iceforge.terra.gateway.sql;

import org.iceforge.terra.gateway.engine.QueryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One {@code ORDER BY} item, parsed from {@code "emissions_tonnes DESC, year"} style input.
 */
public record OrderSpec(Identifier column, boolean descending) {

    public static List<OrderSpec> parse(String orderBy) {
        List<OrderSpec> out = new ArrayList<>();
        for (String item : items(orderBy)) {
            String[] parts = item.split("\\s+");
            if (parts.length > 2) {
                throw QueryException.validation("Invalid order_by item '" + item + "': expected '<column> [ASC|DESC]'");
            }
            boolean desc = false;
            if (parts.length == 2) {
                String dir = parts[1].toUpperCase(Locale.ROOT);
                if (dir.equals("DESC")) {
                    desc = true;
                } else if (!dir.equals("ASC")) {
                    throw QueryException.validation("Invalid order_by direction '" + parts[1] + "': expected ASC or DESC");
                }
            }
            out.add(new OrderSpec(Identifier.column(parts[0]), desc));
        }
        return out;
    }

    static List<String> columnNames(String orderBy) {
        List<String> names = new ArrayList<>();
        for (String item : items(orderBy)) {
            names.add(item.split("\\s+")[0]);
        }
        return names;
    }

    private static List<String> items(String orderBy) {
        List<String> items = new ArrayList<>();
        if (orderBy == null || orderBy.isBlank()) {
            return items;
        }
        for (String raw : orderBy.split(",")) {
            String item = raw.trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    public OrderSpec withColumn(Identifier other) {
        return new OrderSpec(other, descending);
    }

    public String render() {
        return column.quoted() + (descending ? " DESC" : " ASC");
    }
}
