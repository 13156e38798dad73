package com.tinqer.schema;

import java.util.Map;

/**
 * Entry point for defining plans against a database.
 *
 * <p>A plain schema carries no runtime data. {@link #withRowFilters(Map)}
 * returns a schema that injects per-table predicates into SELECT, UPDATE and
 * DELETE plans; {@link #withContext(Map)} binds the values those predicates
 * read. Schemas are immutable.
 *
 * <pre>
 *   DatabaseSchema schema = DatabaseSchema.create()
 *       .withRowFilters(Map.of("users", TableRowFilter.uniform("(u, ctx) => u.orgId === ctx.orgId")))
 *       .withContext(Map.of("orgId", 7));
 * </pre>
 */
public final class DatabaseSchema {

    private static final DatabaseSchema PLAIN = new DatabaseSchema(null);

    private final RowFilterState rowFilters;

    private DatabaseSchema(RowFilterState rowFilters) {
        this.rowFilters = rowFilters;
    }

    public static DatabaseSchema create() {
        return PLAIN;
    }

    public DatabaseSchema withRowFilters(Map<String, TableRowFilter> filters) {
        return new DatabaseSchema(new RowFilterState(filters, null));
    }

    /**
     * Binds the context row filters read through their {@code ctx} parameter.
     *
     * @throws IllegalStateException if no row filters were declared
     */
    public DatabaseSchema withContext(Map<String, Object> context) {
        if (rowFilters == null) {
            throw new IllegalStateException("withContext() requires row filters. Call withRowFilters() first.");
        }
        return new DatabaseSchema(rowFilters.withContext(context));
    }

    /**
     * Returns the row filter state, or null when none were declared.
     */
    public RowFilterState rowFilters() {
        return rowFilters;
    }
}
