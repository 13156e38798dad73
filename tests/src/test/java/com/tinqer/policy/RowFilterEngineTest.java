package com.tinqer.policy;

import com.tinqer.exception.PolicyBindingException;
import com.tinqer.plan.Tinqer;
import com.tinqer.runtime.CompiledStatement;
import com.tinqer.schema.DatabaseSchema;
import com.tinqer.schema.TableRowFilter;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Integration
@TestCategories.Tier1
@DisplayName("Row filter engine")
public class RowFilterEngineTest extends TestBase {

    private static final String CTX_ORG = RowFilterEngine.CONTEXT_PARAM_PREFIX + "orgId";

    private DatabaseSchema filtered;
    private DatabaseSchema bound;

    @Override
    protected void doSetUp() {
        Map<String, TableRowFilter> filters = new LinkedHashMap<>();
        filters.put("users", TableRowFilter.uniform("(u, ctx) => u.orgId === ctx.orgId"));
        filters.put("posts", TableRowFilter.uniform("(p, ctx) => p.orgId === ctx.orgId"));
        filters.put("audit", TableRowFilter.disabled());
        filtered = DatabaseSchema.create().withRowFilters(filters);
        bound = filtered.withContext(Map.of("orgId", 7));
    }

    @Nested
    @DisplayName("SELECT")
    class Select {

        @Test
        @DisplayName("Table leaf becomes a filtered derived table under the table name")
        void testWrapsTable() {
            // Given
            CompiledStatement stmt = sqlite(Tinqer.defineSelect(bound, "q => q.from('users').select(u => u.id)"));

            // Then
            assertThat(stmt.sql()).isEqualTo(
                "SELECT \"id\" FROM (SELECT * FROM \"users\" WHERE \"orgId\" = @" + CTX_ORG + ") AS \"users\"");
            assertThat(stmt.params()).containsEntry(CTX_ORG, 7);
        }

        @Test
        @DisplayName("Outer predicates stay on the outer level")
        void testOuterWhere() {
            CompiledStatement stmt = postgres(
                Tinqer.defineSelect(bound, "q => q.from('users').where(u => u.age > 18)"));

            assertThat(stmt.sql()).isEqualTo(
                "SELECT * FROM (SELECT * FROM \"users\" WHERE \"orgId\" = $(" + CTX_ORG + ")) AS \"users\""
                    + " WHERE \"age\" > $(__p1)");
            assertThat(stmt.params()).containsEntry("__p1", 18L).containsEntry(CTX_ORG, 7);
        }

        @Test
        @DisplayName("Join inners are filtered too and share context parameters")
        void testJoinFiltered() {
            String query = "q => q.from('users')"
                + ".join(q.from('posts'), u => u.id, p => p.userId, (u, p) => ({ u, p }))"
                + ".select(r => ({ title: r.p.title }))";

            CompiledStatement stmt = sqlite(Tinqer.defineSelect(bound, query));

            assertThat(stmt.sql())
                .contains("FROM (SELECT * FROM \"users\" WHERE \"orgId\" = @" + CTX_ORG + ") AS \"t0\"")
                .contains("INNER JOIN (SELECT * FROM \"posts\" WHERE \"orgId\" = @" + CTX_ORG + ") AS \"t1\"")
                .contains("ON \"t0\".\"id\" = \"t1\".\"userId\"");
            assertThat(stmt.params()).containsOnlyKeys(CTX_ORG);
        }

        @Test
        @DisplayName("Filter literals continue the plan's auto-parameter numbering")
        void testFilterAutoParams() {
            DatabaseSchema schema = DatabaseSchema.create()
                .withRowFilters(Map.of("users",
                    TableRowFilter.uniform("(u, ctx) => u.status == 'active' && u.orgId == ctx.orgId")))
                .withContext(Map.of("orgId", 3));

            CompiledStatement stmt = sqlite(Tinqer.defineSelect(schema, "q => q.from('users').where(u => u.age > 18)"));

            assertThat(stmt.sql()).isEqualTo(
                "SELECT * FROM (SELECT * FROM \"users\" WHERE (\"status\" = @__p2 AND \"orgId\" = @" + CTX_ORG
                    + ")) AS \"users\" WHERE \"age\" > @__p1");
            assertThat(stmt.params())
                .containsEntry("__p1", 18L)
                .containsEntry("__p2", "active")
                .containsEntry(CTX_ORG, 3);
        }

        @Test
        @DisplayName("Disabled tables are left alone")
        void testDisabledTable() {
            CompiledStatement stmt = sqlite(Tinqer.defineSelect(bound, "q => q.from('audit')"));

            assertThat(stmt.sql()).isEqualTo("SELECT * FROM \"audit\"");
        }
    }

    @Nested
    @DisplayName("UPDATE and DELETE")
    class Mutations {

        @Test
        @DisplayName("UPDATE ANDs the filter and a post-update check")
        void testUpdate() {
            // Given
            Map<String, Object> params = Map.of("userId", 1, "newOrgId", 7);

            // When
            CompiledStatement stmt = sqlite(Tinqer.defineUpdate(bound,
                "(q, p) => q.update('users').set({ orgId: p.newOrgId }).where(u => u.id === p.userId)"), params);

            // Then
            assertThat(stmt.sql()).isEqualTo(
                "UPDATE \"users\" SET \"orgId\" = @newOrgId WHERE ((\"id\" = @userId AND \"orgId\" = @" + CTX_ORG
                    + ") AND @newOrgId = @" + CTX_ORG + ")");
            assertThat(stmt.params()).containsEntry(CTX_ORG, 7);
        }

        @Test
        @DisplayName("Boolean filter columns keep their name when assigned a computed value")
        void testBooleanColumnFilter() {
            // Given
            DatabaseSchema schema = DatabaseSchema.create()
                .withRowFilters(Map.of("users", TableRowFilter.uniform("(r, c) => r.orgId == c.orgId && r.active")))
                .withContext(Map.of("orgId", 7));
            Map<String, Object> params = Map.of("a", true, "b", false);

            // When
            CompiledStatement computed = postgres(Tinqer.defineUpdate(schema,
                "(q, p) => q.update('users').set({ active: p.a ?? p.b }).where(u => u.id == 1)"), params);
            CompiledStatement direct = postgres(Tinqer.defineUpdate(schema,
                "(q, p) => q.update('users').set({ active: p.a }).where(u => u.id == 1)"), params);

            // Then
            String filter = "(\"orgId\" = $(" + CTX_ORG + ") AND \"active\")";
            assertThat(computed.sql()).isEqualTo(
                "UPDATE \"users\" SET \"active\" = COALESCE($(a), $(b)) WHERE ((\"id\" = $(__p1) AND "
                    + filter + ") AND " + filter + ")");
            assertThat(direct.sql()).endsWith(" AND (\"orgId\" = $(" + CTX_ORG + ") AND $(a)))");
        }

        @Test
        @DisplayName("DELETE ANDs the filter onto WHERE")
        void testDelete() {
            CompiledStatement stmt = sqlite(
                Tinqer.defineDelete(bound, "q => q.deleteFrom('posts').allowFullTableDelete()"));

            assertThat(stmt.sql()).isEqualTo("DELETE FROM \"posts\" WHERE \"orgId\" = @" + CTX_ORG);
        }

        @Test
        @DisplayName("INSERT is never filtered and needs no context")
        void testInsertUnfiltered() {
            CompiledStatement stmt = sqlite(Tinqer.defineInsert(filtered,
                "(q, p) => q.insertInto('users').values({ name: p.name })"), Map.of("name", "Ann"));

            assertThat(stmt.sql()).isEqualTo("INSERT INTO \"users\" (\"name\") VALUES (@name)");
        }
    }

    @Nested
    @DisplayName("Binding failures")
    class BindingFailures {

        @Test
        @DisplayName("Filters without context fail at finalize")
        void testMissingContext() {
            assertThatThrownBy(() -> sqlite(Tinqer.defineSelect(filtered, "q => q.from('users')")))
                .isInstanceOf(PolicyBindingException.class)
                .hasMessageContaining("Row filters require context binding");
        }

        @Test
        @DisplayName("Tables without configuration fail")
        void testMissingTable() {
            assertThatThrownBy(() -> sqlite(Tinqer.defineSelect(bound, "q => q.from('comments')")))
                .isInstanceOf(PolicyBindingException.class)
                .hasMessageContaining("missing configuration for table \"comments\"");
        }

        @Test
        @DisplayName("Context keys read by a filter must be bound")
        void testMissingContextKey() {
            DatabaseSchema schema = filtered.withContext(Map.of("tenant", 1));

            assertThatThrownBy(() -> sqlite(Tinqer.defineSelect(schema, "q => q.from('users')")))
                .isInstanceOf(PolicyBindingException.class)
                .hasMessageContaining("missing required key \"orgId\"");
        }

        @Test
        @DisplayName("Context parameter names may not collide with caller parameters")
        void testCollision() {
            Map<String, Object> params = Map.of(CTX_ORG, 99);

            assertThatThrownBy(() -> sqlite(Tinqer.defineSelect(bound, "q => q.from('users')"), params))
                .isInstanceOf(PolicyBindingException.class)
                .hasMessageContaining("collided with existing parameter");
        }
    }
}
