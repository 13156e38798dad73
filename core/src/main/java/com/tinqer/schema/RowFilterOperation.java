package com.tinqer.schema;

/**
 * Statement kinds a row filter can apply to. INSERT is never filtered.
 */
public enum RowFilterOperation {
    SELECT("select"),
    UPDATE("update"),
    DELETE("delete");

    private final String key;

    RowFilterOperation(String key) {
        this.key = key;
    }

    /**
     * Returns the lower-case name used in filter configuration and messages.
     */
    public String key() {
        return key;
    }
}
