package com.tinqer.generator;

import com.tinqer.plan.Tinqer;
import com.tinqer.runtime.CompiledStatement;
import com.tinqer.schema.DatabaseSchema;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("SQLite SQL generation")
public class SqliteSQLGeneratorTest extends TestBase {

    private final DatabaseSchema schema = DatabaseSchema.create();

    @Test
    @DisplayName("Placeholders use @name")
    void testPlaceholders() {
        CompiledStatement stmt = sqlite(
            Tinqer.defineSelect(schema, "(q, p) => q.from('users').where(u => u.age >= p.minAge && u.name != 'x')"),
            Map.of("minAge", 21));

        assertThat(stmt.sql()).isEqualTo("SELECT * FROM \"users\" WHERE (\"age\" >= @minAge AND \"name\" != @__p1)");
        assertThat(stmt.params()).containsEntry("minAge", 21).containsEntry("__p1", "x");
        assertThat(SqliteSQLGenerator.INSTANCE.dialectName()).isEqualTo("sqlite");
    }

    @Test
    @DisplayName("OFFSET without LIMIT uses LIMIT -1")
    void testSkipOnly() {
        logStep("Generate skip() without take()");
        String sql = sqlite(Tinqer.defineSelect(schema, "q => q.from('users').orderBy(u => u.id).skip(10)")).sql();

        assertThat(sql).isEqualTo("SELECT * FROM \"users\" ORDER BY \"id\" ASC LIMIT -1 OFFSET @__p1");
    }

    @Test
    @DisplayName("take and skip together keep LIMIT before OFFSET")
    void testTakeAndSkip() {
        String sql = sqlite(Tinqer.defineSelect(schema, "q => q.from('users').skip(10).take(5)")).sql();

        assertThat(sql).isEqualTo("SELECT * FROM \"users\" LIMIT @__p2 OFFSET @__p1");
    }

    @Test
    @DisplayName("Array parameters expand with @ placeholders")
    void testInList() {
        CompiledStatement stmt = sqlite(
            Tinqer.defineSelect(schema, "(q, p) => q.from('users').where(u => p.ids.includes(u.id))"),
            Map.of("ids", List.of(1, 2, 3)));

        assertThat(stmt.sql()).isEqualTo("SELECT * FROM \"users\" WHERE \"id\" IN (@ids_0, @ids_1, @ids_2)");
    }

    @Test
    @DisplayName("EXISTS form is shared with Postgres")
    void testAny() {
        String sql = sqlite(Tinqer.defineSelect(schema, "q => q.from('users').any(u => u.isActive)")).sql();

        assertThat(sql).isEqualTo("SELECT CASE WHEN EXISTS(SELECT 1 FROM \"users\" WHERE \"isActive\") THEN 1 ELSE 0 END");
    }
}
