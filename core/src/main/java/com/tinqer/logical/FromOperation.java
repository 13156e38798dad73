package com.tinqer.logical;

/**
 * Query root: a table, or a derived table built from a subquery.
 *
 * @param table the table name, null for a subquery
 * @param schema optional schema qualifier
 * @param subquery derived-table query, null for a plain table
 * @param aliasHint alias to use for a derived table
 */
public record FromOperation(String table, String schema, QueryOperation subquery, String aliasHint)
    implements QueryOperation {

    public FromOperation {
        if (table == null && subquery == null) {
            throw new IllegalArgumentException("from requires a table or a subquery");
        }
    }

    public static FromOperation table(String table) {
        return new FromOperation(table, null, null, null);
    }

    public static FromOperation subquery(QueryOperation subquery, String aliasHint) {
        return new FromOperation(null, null, subquery, aliasHint);
    }

    /**
     * Returns {@code schema.table}, or just the table name.
     */
    public String qualifiedName() {
        return schema != null ? schema + "." + table : table;
    }

    public FromOperation withSubquery(QueryOperation newSubquery) {
        return new FromOperation(table, schema, newSubquery, aliasHint);
    }

    @Override
    public String operationType() {
        return "from";
    }

    @Override
    public QueryOperation source() {
        return null;
    }

    @Override
    public QueryOperation withSource(QueryOperation newSource) {
        return this;
    }
}
