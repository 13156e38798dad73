package com.tinqer.visitor;

import java.util.HashMap;
import java.util.Map;

/**
 * Every method the query language understands. Source method names are
 * mapped here once, so dispatch over operations is an exhaustive switch.
 */
public enum QueryMethod {
    // Roots
    FROM("from"),
    INSERT_INTO("insertInto"),
    UPDATE("update"),
    DELETE_FROM("deleteFrom"),

    // Chainable
    WHERE("where"),
    SELECT("select"),
    JOIN("join"),
    GROUP_JOIN("groupJoin"),
    SELECT_MANY("selectMany"),
    DEFAULT_IF_EMPTY("defaultIfEmpty"),
    GROUP_BY("groupBy"),
    ORDER_BY("orderBy"),
    ORDER_BY_DESCENDING("orderByDescending"),
    THEN_BY("thenBy"),
    THEN_BY_DESCENDING("thenByDescending"),
    DISTINCT("distinct"),
    TAKE("take"),
    SKIP("skip"),
    REVERSE("reverse"),

    // Terminal
    FIRST("first"),
    FIRST_OR_DEFAULT("firstOrDefault"),
    SINGLE("single"),
    SINGLE_OR_DEFAULT("singleOrDefault"),
    LAST("last"),
    LAST_OR_DEFAULT("lastOrDefault"),
    ANY("any"),
    ALL("all"),
    CONTAINS("contains"),
    COUNT("count"),
    LONG_COUNT("longCount"),
    SUM("sum"),
    AVERAGE("average"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),

    // Statements
    VALUES("values"),
    ON_CONFLICT("onConflict"),
    DO_NOTHING("doNothing"),
    DO_UPDATE_SET("doUpdateSet"),
    RETURNING("returning"),
    SET("set"),
    ALLOW_FULL_TABLE_UPDATE("allowFullTableUpdate"),
    ALLOW_FULL_TABLE_DELETE("allowFullTableDelete");

    private static final Map<String, QueryMethod> BY_NAME = new HashMap<>();

    static {
        for (QueryMethod method : values()) {
            BY_NAME.put(method.sourceName, method);
        }
    }

    private final String sourceName;

    QueryMethod(String sourceName) {
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }

    public boolean isRoot() {
        return this == FROM || this == INSERT_INTO || this == UPDATE || this == DELETE_FROM;
    }

    /**
     * Looks up a method by its source name.
     *
     * @return the method, or null if the name is not part of the query language
     */
    public static QueryMethod fromSourceName(String name) {
        return name == null ? null : BY_NAME.get(name);
    }
}
