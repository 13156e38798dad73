package com.tinqer.plan;

import com.tinqer.exception.ParseStructureException;
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
@DisplayName("SELECT plan handle")
public class SelectPlanHandleTest extends TestBase {

    private final DatabaseSchema schema = DatabaseSchema.create();

    @Nested
    @DisplayName("Composition")
    class Composition {

        @Test
        @DisplayName("Fluent where continues auto-parameter numbering")
        void testFluentWhere() {
            // Given
            SelectPlanHandle base = Tinqer.defineSelect(schema, "q => q.from('users').where(u => u.age > 18)");

            // When
            SelectPlanHandle narrowed = base.where("u => u.name == 'Bob'");
            CompiledStatement stmt = postgres(narrowed);

            // Then
            assertThat(stmt.sql()).isEqualTo(
                "SELECT * FROM \"users\" WHERE \"age\" > $(__p1) AND \"name\" = $(__p2)");
            assertThat(stmt.params()).containsEntry("__p1", 18L).containsEntry("__p2", "Bob");
        }

        @Test
        @DisplayName("Handles are immutable")
        void testImmutable() {
            SelectPlanHandle base = Tinqer.defineSelect(schema, "q => q.from('users')");
            SelectPlanHandle filtered = base.where("u => u.isActive");

            assertThat(postgres(base).sql()).isEqualTo("SELECT * FROM \"users\"");
            assertThat(postgres(filtered).sql()).isEqualTo("SELECT * FROM \"users\" WHERE \"isActive\"");
        }

        @Test
        @DisplayName("Branches from one handle do not share parameters")
        void testBranches() {
            SelectPlanHandle base = Tinqer.defineSelect(schema, "q => q.from('users')");

            CompiledStatement young = postgres(base.where("u => u.age < 30"));
            CompiledStatement old = postgres(base.where("u => u.age > 60"));

            assertThat(young.params()).containsEntry("__p1", 30L);
            assertThat(old.params()).containsEntry("__p1", 60L);
        }

        @Test
        @DisplayName("Ordering, paging and projection compose in clause order")
        void testFullChain() {
            CompiledStatement stmt = postgres(Tinqer.defineSelect(schema, "q => q.from('users')")
                .where("u => u.isActive")
                .orderBy("u => u.name")
                .thenByDescending("u => u.age")
                .skip(20)
                .take(10)
                .select("u => ({ id: u.id, name: u.name })"));

            assertThat(stmt.sql()).isEqualTo(
                "SELECT \"id\" AS \"id\", \"name\" AS \"name\" FROM \"users\" WHERE \"isActive\""
                    + " ORDER BY \"name\" ASC, \"age\" DESC LIMIT $(__p2) OFFSET $(__p1)");
            assertThat(stmt.params()).containsEntry("__p1", 20).containsEntry("__p2", 10);
        }

        @Test
        @DisplayName("Caller parameters bind by name")
        void testCallerParams() {
            SelectPlanHandle plan = Tinqer.defineSelect(schema,
                "(q, p) => q.from('users').where(u => u.age >= p.minAge)");

            CompiledStatement stmt = postgres(plan, Map.of("minAge", 21));

            assertThat(stmt.sql()).isEqualTo("SELECT * FROM \"users\" WHERE \"age\" >= $(minAge)");
            assertThat(stmt.params()).containsEntry("minAge", 21);
        }

        @Test
        @DisplayName("finalize() is deterministic")
        void testDeterministic() {
            SelectPlanHandle plan = Tinqer.defineSelect(schema, "q => q.from('users').where(u => u.age > 18)");

            FinalizedPlan first = plan.finalize(Map.of());
            FinalizedPlan second = plan.finalize(Map.of());

            assertThat(first.operation()).isEqualTo(second.operation());
            assertThat(first.params()).isEqualTo(second.params());
            assertThat(first.kind()).isEqualTo(PlanKind.SELECT);
        }
    }

    @Nested
    @DisplayName("Terminals")
    class Terminals {

        @Test
        @DisplayName("Terminal handles report the TERMINAL stage")
        void testStage() {
            SelectPlanHandle plan = Tinqer.defineSelect(schema, "q => q.from('users')");

            assertThat(plan.stage()).isEqualTo(SelectStage.QUERY);
            assertThat(plan.count().stage()).isEqualTo(SelectStage.TERMINAL);
            assertThat(Tinqer.defineSelect(schema, "q => q.from('users').count()").stage())
                .isEqualTo(SelectStage.TERMINAL);
        }

        @Test
        @DisplayName("first() with predicate")
        void testFirst() {
            CompiledStatement stmt = postgres(Tinqer.defineSelect(schema, "q => q.from('users')")
                .first("u => u.age > 18"));

            assertThat(stmt.sql()).isEqualTo("SELECT * FROM \"users\" WHERE \"age\" > $(__p1) LIMIT 1");
        }

        @Test
        @DisplayName("count() with predicate")
        void testCount() {
            CompiledStatement stmt = postgres(Tinqer.defineSelect(schema, "q => q.from('users')")
                .count("u => u.isActive"));

            assertThat(stmt.sql()).isEqualTo("SELECT COUNT(*) FROM \"users\" WHERE \"isActive\"");
        }

        @Test
        @DisplayName("sum() over a selector")
        void testSum() {
            CompiledStatement stmt = postgres(Tinqer.defineSelect(schema, "q => q.from('orders')")
                .sum("o => o.amount"));

            assertThat(stmt.sql()).isEqualTo("SELECT SUM(\"amount\") FROM \"orders\"");
        }

        @Test
        @DisplayName("max() reuses a preceding scalar select")
        void testMaxAfterSelect() {
            CompiledStatement stmt = postgres(Tinqer.defineSelect(schema, "q => q.from('orders')")
                .select("o => o.amount")
                .max());

            assertThat(stmt.sql()).isEqualTo("SELECT MAX(\"amount\") FROM \"orders\"");
        }

        @Test
        @DisplayName("contains() binds its value as an auto-parameter")
        void testContains() {
            CompiledStatement stmt = postgres(Tinqer.defineSelect(schema, "q => q.from('users')")
                .select("u => u.id")
                .contains(5));

            assertThat(stmt.sql()).isEqualTo(
                "SELECT CASE WHEN EXISTS(SELECT 1 FROM (SELECT \"id\" AS \"__tinqer_value\" FROM \"users\")"
                    + " AS \"__tinqer_contains\" WHERE \"__tinqer_contains\".\"__tinqer_value\" = $(__p1))"
                    + " THEN 1 ELSE 0 END");
            assertThat(stmt.params()).containsEntry("__p1", 5);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("defineSelect rejects statements")
        void testWrongKind() {
            assertThatThrownBy(() -> Tinqer.defineSelect(schema, "q => q.deleteFrom('users')"))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("defineSelect() requires a SELECT query, found delete");
        }

        @Test
        @DisplayName("Fluent lambdas must be arrow functions")
        void testNotALambda() {
            SelectPlanHandle plan = Tinqer.defineSelect(schema, "q => q.from('users')");

            assertThatThrownBy(() -> plan.where("u.age > 18"))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("where expects an arrow function expression");
        }

        @Test
        @DisplayName("sum() needs a selector")
        void testSumWithoutSelector() {
            SelectPlanHandle plan = Tinqer.defineSelect(schema, "q => q.from('orders')");

            assertThatThrownBy(() -> plan.sum(null))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("sum() requires a selector function");
        }
    }
}
