package org.iceforge.terra.gateway.sql;

import java.util.Objects;

public record Condition(Identifier column, Filter filter) {
    public Condition {
        Objects.requireNonNull(column);
        Objects.requireNonNull(filter);
    }
}
