package org.iceforge.terra.gateway.sql;

import java.util.List;

/**
 * Closed set of filter shapes accepted in {@code where} and {@code having}.
 */
public sealed interface Filter permits Filter.Scalar, Filter.InSet, Filter.Between, Filter.Compare, Filter.Contains {

    record Scalar(Object value) implements Filter {
    }

    record InSet(List<Object> values) implements Filter {
        public InSet {
            values = List.copyOf(values);
        }
    }

    record Between(Object low, Object high) implements Filter {
    }

    record Compare(Op op, Object value) implements Filter {
    }

    record Contains(String text) implements Filter {
    }

    enum Op {
        GTE("gte", ">="),
        LTE("lte", "<="),
        GT("gt", ">"),
        LT("lt", "<");

        private final String key;
        private final String sql;

        Op(String key, String sql) {
            this.key = key;
            this.sql = sql;
        }

        public String key() {
            return key;
        }

        public String sql() {
            return sql;
        }

        public static Op fromKey(String key) {
            for (Op op : values()) {
                if (op.key.equals(key)) {
                    return op;
                }
            }
            return null;
        }
    }
}
