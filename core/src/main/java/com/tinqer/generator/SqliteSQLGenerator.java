package com.tinqer.generator;

/**
 * SQLite generator. Placeholders use the named form {@code @name}.
 */
public final class SqliteSQLGenerator extends SQLGenerator {

    public static final SqliteSQLGenerator INSTANCE = new SqliteSQLGenerator();

    private SqliteSQLGenerator() {}

    @Override
    protected String formatParameter(String name) {
        return "@" + name;
    }

    @Override
    public String dialectName() {
        return "sqlite";
    }

    /**
     * SQLite only accepts OFFSET after a LIMIT; a negative limit means no limit.
     */
    @Override
    protected String offsetWithoutLimit(String offset) {
        return "LIMIT -1 OFFSET " + offset;
    }
}
