package com.tinqer.dialect;

import com.tinqer.plan.FinalizedPlan;
import com.tinqer.plan.SelectPlanHandle;
import com.tinqer.plan.Tinqer;
import com.tinqer.runtime.CompiledStatement;
import com.tinqer.schema.DatabaseSchema;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("PostgresDialect")
public class PostgresDialectTest extends TestBase {

    private final DatabaseSchema schema = DatabaseSchema.create();

    @Test
    @DisplayName("Dialect name")
    void testDialectName() {
        assertThat(PostgresDialect.INSTANCE.name()).isEqualTo("postgres");
    }

    @Test
    @DisplayName("RETURNING is supported")
    void testReturning() {
        CompiledStatement stmt = PostgresDialect.INSTANCE.toSql(
            Tinqer.insertInto(schema, "users").values(Map.of("name", "Ann")).returning("u => u.id"), Map.of());

        assertThat(stmt.sql()).isEqualTo("INSERT INTO \"users\" (\"name\") VALUES ($(__p1)) RETURNING \"id\"");
    }

    @Test
    @DisplayName("Booleans are bound as-is")
    void testBooleansUnchanged() {
        CompiledStatement stmt = PostgresDialect.INSTANCE.toSql(
            Tinqer.update(schema, "users").set(Map.of("isActive", true)).allowFullTableUpdate(), Map.of());

        assertThat(stmt.params()).containsEntry("__p1", true);
    }

    @Test
    @DisplayName("Array expansion keeps the original entry")
    void testExpandArrayParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("ids", List.of(1, 2));
        params.put("tags", new String[] {"a", "b"});
        params.put("name", "x");

        Map<String, Object> expanded = SqlDialect.expandArrayParams(params);

        assertThat(expanded).containsKeys("ids", "tags", "name");
        assertThat(expanded).containsEntry("ids_0", 1).containsEntry("ids_1", 2)
            .containsEntry("tags_0", "a").containsEntry("tags_1", "b");
        assertThat(expanded).doesNotContainKey("name_0");
    }

    @Test
    @DisplayName("A finalized plan compiles the same as its handle")
    void testFinalizedPlan() {
        SelectPlanHandle plan = Tinqer.defineSelect(schema, "(q, p) => q.from('users').where(u => u.id == p.id)");
        FinalizedPlan finalized = plan.finalize(Map.of("id", 9));

        CompiledStatement fromHandle = PostgresDialect.INSTANCE.toSql(plan, Map.of("id", 9));
        CompiledStatement fromFinalized = PostgresDialect.INSTANCE.toSql(finalized);

        assertThat(fromFinalized.sql()).isEqualTo(fromHandle.sql()).isEqualTo("SELECT * FROM \"users\" WHERE \"id\" = $(id)");
        assertThat(fromFinalized.params()).isEqualTo(fromHandle.params());
    }
}
