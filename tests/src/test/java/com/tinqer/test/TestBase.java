package com.tinqer.test;

import com.tinqer.cache.ParseCache;
import com.tinqer.cache.ParseCacheConfig;
import com.tinqer.dialect.PostgresDialect;
import com.tinqer.dialect.SqliteDialect;
import com.tinqer.plan.FinalizablePlan;
import com.tinqer.runtime.CompiledStatement;
import com.tinqer.runtime.TinqerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Base class for tinqer tests.
 *
 * <p>Every test starts with an empty, default-sized parse cache so cache
 * hits from other tests cannot leak into assertions. Subclasses hook in
 * through {@link #doSetUp()} and {@link #doTearDown()}.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    final void setUp(TestInfo info) {
        testName = info.getDisplayName();
        TinqerConfig.reset();
        ParseCache.getInstance().configure(ParseCacheConfig.fromSystemConfig());
        ParseCache.getInstance().clear();
        doSetUp();
    }

    @AfterEach
    final void tearDown() {
        doTearDown();
        ParseCache.getInstance().clear();
    }

    protected void doSetUp() {}

    protected void doTearDown() {}

    protected String testName() {
        return testName;
    }

    protected void logStep(String step) {
        logger.debug("[{}] {}", testName, step);
    }

    protected void logData(String label, Object value) {
        logger.debug("[{}] {}: {}", testName, label, value);
    }

    // ==================== SQL helpers ====================

    protected CompiledStatement postgres(FinalizablePlan plan) {
        return postgres(plan, Map.of());
    }

    protected CompiledStatement postgres(FinalizablePlan plan, Map<String, ?> params) {
        CompiledStatement statement = PostgresDialect.INSTANCE.toSql(plan, params);
        logData("Generated SQL", statement.sql());
        return statement;
    }

    protected CompiledStatement sqlite(FinalizablePlan plan) {
        return sqlite(plan, Map.of());
    }

    protected CompiledStatement sqlite(FinalizablePlan plan, Map<String, ?> params) {
        CompiledStatement statement = SqliteDialect.INSTANCE.toSql(plan, params);
        logData("Generated SQL", statement.sql());
        return statement;
    }
}
