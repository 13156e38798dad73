package com.tinqer.dialect;

import com.tinqer.generator.SQLGenerator;
import com.tinqer.plan.FinalizablePlan;
import com.tinqer.plan.FinalizedPlan;
import com.tinqer.runtime.CompiledStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a plan into a {@link CompiledStatement} for one database.
 *
 * <p>The dialect finalizes the plan (merging parameters and applying row
 * filters), checks what the back end supports, generates SQL and prepares the
 * parameter map for binding: array values are expanded to
 * {@code name_0, name_1, ...} for drivers without array binding.
 *
 * <p>Example usage:
 * <pre>
 *   CompiledStatement stmt = PostgresDialect.INSTANCE.toSql(plan, Map.of("minAge", 18));
 *   // stmt.sql():    SELECT * FROM "users" WHERE "age" >= $(minAge)
 *   // stmt.params(): {minAge=18}
 * </pre>
 */
public abstract class SqlDialect {

    private static final Logger logger = LoggerFactory.getLogger(SqlDialect.class);

    /**
     * Generator emitting this dialect's SQL.
     */
    protected abstract SQLGenerator generator();

    public String name() {
        return generator().dialectName();
    }

    /**
     * Finalizes the plan with the caller's parameters and compiles it.
     *
     * @param plan a plan handle
     * @param params caller parameters, may be null
     * @return the SQL and its parameters
     */
    public CompiledStatement toSql(FinalizablePlan plan, Map<String, ?> params) {
        Objects.requireNonNull(plan, "plan must not be null");
        return toSql(plan.finalize(params));
    }

    /**
     * Compiles an already finalized plan.
     */
    public CompiledStatement toSql(FinalizedPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        checkCapabilities(plan);
        String sql = generator().generate(plan.operation(), plan.params());
        Map<String, Object> bound = normalizeParams(expandArrayParams(plan.params()));
        logger.debug("Compiled {} {} statement with {} parameters", name(), plan.kind(), bound.size());
        return new CompiledStatement(sql, bound, plan.autoParamInfos());
    }

    /**
     * Rejects plans the back end cannot execute. Accepts everything by default.
     */
    protected void checkCapabilities(FinalizedPlan plan) {
    }

    /**
     * Converts parameter values to the driver's wire types. Identity by default.
     */
    protected Map<String, Object> normalizeParams(Map<String, Object> params) {
        return params;
    }

    /**
     * Copies the parameters, adding {@code name_i} for each element of every
     * collection or array value. The original entry is kept.
     */
    static Map<String, Object> expandArrayParams(Map<String, Object> params) {
        Map<String, Object> expanded = new LinkedHashMap<>(params);
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Collection) {
                Iterator<?> it = ((Collection<?>) value).iterator();
                for (int i = 0; it.hasNext(); i++) {
                    expanded.put(entry.getKey() + "_" + i, it.next());
                }
            } else if (value != null && value.getClass().isArray()) {
                int length = Array.getLength(value);
                for (int i = 0; i < length; i++) {
                    expanded.put(entry.getKey() + "_" + i, Array.get(value, i));
                }
            }
        }
        return expanded;
    }
}
