package com.tinqer.expression;

import java.util.List;
import java.util.Objects;

/**
 * Ranking window function, e.g.
 * {@code ROW_NUMBER() OVER (PARTITION BY "dept" ORDER BY "salary" DESC)}.
 */
public record WindowFunctionExpression(Function function,
                                       List<ValueExpression> partitionBy,
                                       List<WindowOrder> orderBy) implements ValueExpression {

    public enum Function {
        ROW_NUMBER("rowNumber", "ROW_NUMBER"),
        RANK("rank", "RANK"),
        DENSE_RANK("denseRank", "DENSE_RANK");

        private final String sourceName;
        private final String sql;

        Function(String sourceName, String sql) {
            this.sourceName = sourceName;
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }

        public static Function fromSourceName(String name) {
            for (Function f : values()) {
                if (f.sourceName.equals(name)) {
                    return f;
                }
            }
            return null;
        }
    }

    public record WindowOrder(ValueExpression expression, boolean descending) {
        public WindowOrder {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    public WindowFunctionExpression {
        Objects.requireNonNull(function, "function must not be null");
        partitionBy = List.copyOf(partitionBy);
        orderBy = List.copyOf(orderBy);
    }
}
