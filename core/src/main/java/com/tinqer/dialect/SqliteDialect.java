package com.tinqer.dialect;

import com.tinqer.exception.DialectCapabilityException;
import com.tinqer.exception.ErrorContext;
import com.tinqer.generator.SQLGenerator;
import com.tinqer.generator.SqliteSQLGenerator;
import com.tinqer.logical.InsertOperation;
import com.tinqer.logical.UpdateOperation;
import com.tinqer.plan.FinalizedPlan;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQLite dialect.
 *
 * <p>SQLite has no boolean or timestamp storage class, so parameters are
 * normalized before binding: booleans become {@code 1}/{@code 0} and
 * {@link Date}, {@link Instant} and {@link LocalDateTime} values become
 * {@code yyyy-MM-dd HH:mm:ss} text in the system time zone. RETURNING is
 * rejected.
 */
public final class SqliteDialect extends SqlDialect {

    public static final SqliteDialect INSTANCE = new SqliteDialect();

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private SqliteDialect() {}

    @Override
    protected SQLGenerator generator() {
        return SqliteSQLGenerator.INSTANCE;
    }

    @Override
    protected void checkCapabilities(FinalizedPlan plan) {
        if (plan.operation() instanceof InsertOperation) {
            InsertOperation insert = (InsertOperation) plan.operation();
            if (insert.returning() != null) {
                throw new DialectCapabilityException("SQLite adapter does not support INSERT ... RETURNING clauses",
                    ErrorContext.of("insert", insert.table(), "returning"));
            }
        } else if (plan.operation() instanceof UpdateOperation) {
            UpdateOperation update = (UpdateOperation) plan.operation();
            if (update.returning() != null) {
                throw new DialectCapabilityException("SQLite adapter does not support UPDATE ... RETURNING clauses",
                    ErrorContext.of("update", update.table(), "returning"));
            }
        }
    }

    @Override
    protected Map<String, Object> normalizeParams(Map<String, Object> params) {
        Map<String, Object> converted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            converted.put(entry.getKey(), normalize(entry.getValue()));
        }
        return converted;
    }

    static Object normalize(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof Date) {
            return format(Instant.ofEpochMilli(((Date) value).getTime()));
        }
        if (value instanceof Instant) {
            return format((Instant) value);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(TIMESTAMP);
        }
        return value;
    }

    private static String format(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneId.systemDefault()).format(TIMESTAMP);
    }
}
