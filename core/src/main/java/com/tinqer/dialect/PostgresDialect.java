package com.tinqer.dialect;

import com.tinqer.generator.PostgresSQLGenerator;
import com.tinqer.generator.SQLGenerator;

/**
 * PostgreSQL dialect for named-parameter drivers such as pg-promise style
 * {@code $(name)} formatters. Supports RETURNING.
 */
public final class PostgresDialect extends SqlDialect {

    public static final PostgresDialect INSTANCE = new PostgresDialect();

    private PostgresDialect() {}

    @Override
    protected SQLGenerator generator() {
        return PostgresSQLGenerator.INSTANCE;
    }
}
