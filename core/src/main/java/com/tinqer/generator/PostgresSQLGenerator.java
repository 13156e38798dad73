package com.tinqer.generator;

/**
 * PostgreSQL generator. Placeholders use the named form {@code $(name)}.
 */
public final class PostgresSQLGenerator extends SQLGenerator {

    public static final PostgresSQLGenerator INSTANCE = new PostgresSQLGenerator();

    private PostgresSQLGenerator() {}

    @Override
    protected String formatParameter(String name) {
        return "$(" + name + ")";
    }

    @Override
    public String dialectName() {
        return "postgres";
    }
}
