package com.tinqer.generator;

/**
 * Utilities for quoting SQL identifiers.
 *
 * <p>Every table, column and alias the generators emit goes through
 * {@link #quoteIdentifier(String)}, so names coming from query source can
 * never break out of the identifier position.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("users");             // "users"
 *   SQLQuoting.quoteTable("auth", "users");          // "auth"."users"
 *   SQLQuoting.quoteColumn("t1", "name");            // "t1"."name"
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        // Escape double quotes by doubling them (SQL standard)
        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Quotes a table name with an optional schema qualifier.
     *
     * @param schema the schema, may be null
     * @param table the table name
     * @return {@code "schema"."table"} or {@code "table"}
     */
    public static String quoteTable(String schema, String table) {
        if (schema == null) {
            return quoteIdentifier(table);
        }
        return quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }

    /**
     * Quotes a column, qualified by a table alias when one is given.
     */
    public static String quoteColumn(String alias, String column) {
        if (alias == null) {
            return quoteIdentifier(column);
        }
        return quoteIdentifier(alias) + "." + quoteIdentifier(column);
    }
}
