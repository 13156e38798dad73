package com.tinqer.plan;

import com.tinqer.exception.ParseStructureException;
import com.tinqer.exception.SemanticPolicyException;
import com.tinqer.runtime.CompiledStatement;
import com.tinqer.schema.DatabaseSchema;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Integration
@TestCategories.Tier1
@DisplayName("UPDATE plans")
public class UpdatePlanTest extends TestBase {

    private final DatabaseSchema schema = DatabaseSchema.create();

    @Nested
    @DisplayName("Stages")
    class Stages {

        @Test
        @DisplayName("set() then where() reaches COMPLETE")
        void testFluentStages() {
            // Given
            UpdatePlan.Initial initial = Tinqer.update(schema, "users");

            // When
            UpdatePlan.WithSet withSet = initial.set(Map.of("name", "Ann"));
            UpdatePlan.Complete complete = withSet.where("u => u.id == 1");

            // Then
            assertThat(initial.stage()).isEqualTo(UpdateStage.INITIAL);
            assertThat(withSet.stage()).isEqualTo(UpdateStage.WITH_SET);
            assertThat(complete.stage()).isEqualTo(UpdateStage.COMPLETE);
            assertThat(postgres(complete).sql())
                .isEqualTo("UPDATE \"users\" SET \"name\" = $(__p1) WHERE \"id\" = $(__p2)");
        }

        @Test
        @DisplayName("defineUpdate resumes at the stage the query reached")
        void testDefineResumesStage() {
            assertThat(Tinqer.defineUpdate(schema, "q => q.update('users')"))
                .isInstanceOf(UpdatePlan.Initial.class);
            assertThat(Tinqer.defineUpdate(schema, "q => q.update('users').set({ a: 1 })"))
                .isInstanceOf(UpdatePlan.WithSet.class);
            assertThat(Tinqer.defineUpdate(schema, "q => q.update('users').set({ a: 1 }).allowFullTableUpdate()"))
                .isInstanceOf(UpdatePlan.Complete.class);
            assertThat(Tinqer.defineUpdate(schema,
                "q => q.update('users').set({ a: 1 }).where(u => u.id == 2).returning(u => u.id)"))
                .isInstanceOf(UpdatePlan.WithReturning.class);
        }

        @Test
        @DisplayName("Finalizing before set() is an error")
        void testInitialFinalize() {
            assertThatThrownBy(() -> Tinqer.update(schema, "users").finalize(Map.of()))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("UPDATE statement requires set()");
        }
    }

    @Nested
    @DisplayName("SQL")
    class Sql {

        @Test
        @DisplayName("Lambda assignments can read the current row")
        void testLambdaSet() {
            CompiledStatement stmt = postgres(Tinqer.update(schema, "counters")
                .set("c => ({ hits: c.hits + 1 })")
                .where("c => c.id == 9"));

            assertThat(stmt.sql()).isEqualTo(
                "UPDATE \"counters\" SET \"hits\" = (\"hits\" + $(__p1)) WHERE \"id\" = $(__p2)");
        }

        @Test
        @DisplayName("Repeated where() calls are ANDed")
        void testRepeatedWhere() {
            CompiledStatement stmt = postgres(Tinqer.update(schema, "users")
                .set(Map.of("name", "Ann"))
                .where("u => u.id == 1")
                .where("u => u.isActive"));

            assertThat(stmt.sql()).isEqualTo(
                "UPDATE \"users\" SET \"name\" = $(__p1) WHERE (\"id\" = $(__p2) AND \"isActive\")");
        }

        @Test
        @DisplayName("Full table update needs the explicit opt-in")
        void testFullTable() {
            CompiledStatement stmt = postgres(Tinqer.update(schema, "users")
                .set(Map.of("isActive", false))
                .allowFullTableUpdate());

            assertThat(stmt.sql()).isEqualTo("UPDATE \"users\" SET \"isActive\" = $(__p1)");
        }

        @Test
        @DisplayName("Undefined assignments are skipped")
        void testUndefinedAssignment() {
            FinalizablePlan plan = Tinqer.defineUpdate(schema,
                "(q, p) => q.update('users').set({ name: p.name, email: p.email }).where(u => u.id == p.id)");

            CompiledStatement stmt = sqlite(plan, Map.of("name", "Ann", "id", 4));

            assertThat(stmt.sql()).isEqualTo("UPDATE \"users\" SET \"name\" = @name WHERE \"id\" = @id");
        }

        @Test
        @DisplayName("RETURNING on PostgreSQL")
        void testReturning() {
            CompiledStatement stmt = postgres(Tinqer.update(schema, "users")
                .set(Map.of("name", "Ann"))
                .where("u => u.id == 1")
                .returning("u => ({ id: u.id })"));

            assertThat(stmt.sql()).endsWith(" RETURNING \"id\" AS \"id\"");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("WithSet cannot be finalized without WHERE")
        void testMissingWhere() {
            UpdatePlan.WithSet plan = Tinqer.update(schema, "users").set(Map.of("name", "Ann"));

            assertThatThrownBy(() -> plan.finalize(Map.of()))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("UPDATE requires a WHERE clause or explicit allowFullTableUpdate");
        }

        @Test
        @DisplayName("All assignments undefined is an error")
        void testAllUndefined() {
            FinalizablePlan plan = Tinqer.defineUpdate(schema,
                "(q, p) => q.update('users').set({ name: p.name }).allowFullTableUpdate()");

            assertThatThrownBy(() -> postgres(plan))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("UPDATE must specify at least one column assignment");
        }

        @Test
        @DisplayName("set() may only be called once")
        void testSetTwice() {
            assertThatThrownBy(() -> Tinqer.defineUpdate(schema,
                "q => q.update('users').set({ a: 1 }).set({ b: 2 })"))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("set() can only be called once");
        }

        @Test
        @DisplayName("defineUpdate rejects SELECT queries")
        void testWrongKind() {
            assertThatThrownBy(() -> Tinqer.defineUpdate(schema, "q => q.from('users')"))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("defineUpdate() requires a UPDATE query, found select");
        }
    }
}
