package com.tinqer.schema;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.parser.LambdaSourceParser;

import java.util.Objects;

/**
 * Row filter configuration of one table.
 *
 * <p>A filter is a lambda {@code (row, ctx, helpers) => <predicate>}; {@code ctx}
 * reads values from the context bound with
 * {@link DatabaseSchema#withContext(java.util.Map)}.
 */
public sealed interface TableRowFilter {

    /**
     * Returns the filter for the given statement kind, or null when that
     * kind is not filtered.
     */
    AstNode filterFor(RowFilterOperation operation);

    /** The same filter for every statement kind. */
    record Uniform(ArrowFunctionNode filter) implements TableRowFilter {
        public Uniform {
            Objects.requireNonNull(filter, "filter must not be null");
        }

        @Override
        public AstNode filterFor(RowFilterOperation operation) {
            return filter;
        }
    }

    /** One filter per statement kind; a null entry disables filtering for that kind. */
    record PerOperation(AstNode select, AstNode update, AstNode delete) implements TableRowFilter {
        @Override
        public AstNode filterFor(RowFilterOperation operation) {
            return switch (operation) {
                case SELECT -> select;
                case UPDATE -> update;
                case DELETE -> delete;
            };
        }
    }

    /** Filtering explicitly turned off for the table. */
    record Disabled() implements TableRowFilter {
        @Override
        public AstNode filterFor(RowFilterOperation operation) {
            return null;
        }
    }

    static TableRowFilter uniform(String source) {
        return new Uniform(LambdaSourceParser.getInstance().parseLambda(source));
    }

    static TableRowFilter perOperation(String select, String update, String delete) {
        return new PerOperation(parseOrNull(select), parseOrNull(update), parseOrNull(delete));
    }

    static TableRowFilter disabled() {
        return new Disabled();
    }

    private static AstNode parseOrNull(String source) {
        return source == null ? null : LambdaSourceParser.getInstance().parseLambda(source);
    }
}
