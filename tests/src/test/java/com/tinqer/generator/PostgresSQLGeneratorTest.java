package com.tinqer.generator;

import com.tinqer.exception.ParseStructureException;
import com.tinqer.exception.SemanticPolicyException;
import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ComparisonExpression;
import com.tinqer.expression.ComparisonOperator;
import com.tinqer.expression.ParameterExpression;
import com.tinqer.logical.FromOperation;
import com.tinqer.logical.WhereOperation;
import com.tinqer.plan.SelectPlanHandle;
import com.tinqer.plan.Tinqer;
import com.tinqer.runtime.CompiledStatement;
import com.tinqer.schema.DatabaseSchema;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("PostgreSQL SQL generation")
public class PostgresSQLGeneratorTest extends TestBase {

    private final DatabaseSchema schema = DatabaseSchema.create();

    private String sql(String query) {
        return postgres(Tinqer.defineSelect(schema, query)).sql();
    }

    private String sql(String query, Map<String, ?> params) {
        return postgres(Tinqer.defineSelect(schema, query), params).sql();
    }

    @Test
    @DisplayName("Generates from a hand-built operation tree")
    void testDirectGeneration() {
        // Given
        WhereOperation where = new WhereOperation(FromOperation.table("users"),
            new ComparisonExpression(ComparisonOperator.GREATER_THAN,
                ColumnExpression.of("age"), ParameterExpression.named("minAge")));

        // When
        String sql = PostgresSQLGenerator.INSTANCE.generate(where, Map.of("minAge", 18));

        // Then
        assertThat(sql).isEqualTo("SELECT * FROM \"users\" WHERE \"age\" > $(minAge)");
        assertThat(PostgresSQLGenerator.INSTANCE.dialectName()).isEqualTo("postgres");
    }

    @Nested
    @DisplayName("Schema-qualified tables")
    class QualifiedTables {

        @Test
        @DisplayName("from(schema, table) quotes both parts")
        void testSelect() {
            assertThat(sql("q => q.from('app', 'users').where(u => u.id == 1)"))
                .isEqualTo("SELECT * FROM \"app\".\"users\" WHERE \"id\" = $(__p1)");
        }

        @Test
        @DisplayName("Statements accept a schema too")
        void testStatements() {
            assertThat(postgres(Tinqer.defineDelete(schema, "q => q.deleteFrom('app', 'sessions').allowFullTableDelete()")).sql())
                .isEqualTo("DELETE FROM \"app\".\"sessions\"");
            assertThat(postgres(Tinqer.defineUpdate(schema,
                "q => q.update('app', 'users').set({ name: 'x' }).where(u => u.id == 2)")).sql())
                .isEqualTo("UPDATE \"app\".\"users\" SET \"name\" = $(__p1) WHERE \"id\" = $(__p2)");
        }

        @Test
        @DisplayName("A third argument is rejected")
        void testTooManyArguments() {
            assertThatThrownBy(() -> sql("q => q.from('a', 'b', 'c')"))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("from() expects a table name or a schema and a table name");
        }
    }

    @Nested
    @DisplayName("Projections")
    class Projections {

        @Test
        @DisplayName("Scalar projection has no alias")
        void testScalar() {
            assertThat(sql("q => q.from('users').select(u => u.name)")).isEqualTo("SELECT \"name\" FROM \"users\"");
        }

        @Test
        @DisplayName("Object projection aliases each property")
        void testObject() {
            assertThat(sql("q => q.from('users').select(u => ({ userId: u.id, userName: u.name }))"))
                .isEqualTo("SELECT \"id\" AS \"userId\", \"name\" AS \"userName\" FROM \"users\"");
        }

        @Test
        @DisplayName("Arithmetic is parenthesized")
        void testArithmetic() {
            assertThat(sql("q => q.from('products').select(p => ({ discounted: p.price * 0.9 }))"))
                .isEqualTo("SELECT (\"price\" * $(__p1)) AS \"discounted\" FROM \"products\"");
        }

        @Test
        @DisplayName("String concatenation uses ||")
        void testConcat() {
            assertThat(sql("q => q.from('users').select(u => ({ full: u.first + ' ' + u.last }))"))
                .isEqualTo("SELECT ((\"first\" || $(__p1)) || \"last\") AS \"full\" FROM \"users\"");
        }

        @Test
        @DisplayName("Boolean properties are wrapped in CASE")
        void testBooleanProperty() {
            assertThat(sql("q => q.from('users').select(u => ({ adult: u.age >= 18 }))"))
                .isEqualTo("SELECT CASE WHEN \"age\" >= $(__p1) THEN TRUE ELSE FALSE END AS \"adult\" FROM \"users\"");
        }

        @Test
        @DisplayName("Ternaries become CASE WHEN")
        void testConditional() {
            assertThat(sql("q => q.from('users').select(u => ({ label: u.age >= 18 ? 'adult' : 'minor' }))"))
                .isEqualTo("SELECT CASE WHEN \"age\" >= $(__p1) THEN $(__p2) ELSE $(__p3) END AS \"label\""
                    + " FROM \"users\"");
        }

        @Test
        @DisplayName("?? becomes COALESCE")
        void testCoalesce() {
            assertThat(sql("q => q.from('users').select(u => ({ display: u.nickname ?? u.name }))"))
                .isEqualTo("SELECT COALESCE(\"nickname\", \"name\") AS \"display\" FROM \"users\"");
        }

        @Test
        @DisplayName("toLowerCase() becomes LOWER")
        void testLower() {
            assertThat(sql("q => q.from('users').select(u => u.email.toLowerCase())"))
                .isEqualTo("SELECT LOWER(\"email\") FROM \"users\"");
        }

        @Test
        @DisplayName("distinct() prefixes the projection")
        void testDistinct() {
            assertThat(sql("q => q.from('users').select(u => u.city).distinct()"))
                .isEqualTo("SELECT DISTINCT \"city\" FROM \"users\"");
        }
    }

    @Nested
    @DisplayName("Predicates")
    class Predicates {

        @Test
        @DisplayName("Comparisons with null become IS [NOT] NULL")
        void testNullComparisons() {
            assertThat(sql("q => q.from('users').where(u => u.email == null)"))
                .isEqualTo("SELECT * FROM \"users\" WHERE \"email\" IS NULL");
            assertThat(sql("q => q.from('users').where(u => u.email !== null)"))
                .isEqualTo("SELECT * FROM \"users\" WHERE \"email\" IS NOT NULL");
        }

        @Test
        @DisplayName("&& and || are parenthesized, ! negates")
        void testLogical() {
            assertThat(sql("q => q.from('users').where(u => u.isActive && (u.age < 18 || u.age > 65))"))
                .isEqualTo("SELECT * FROM \"users\" WHERE (\"isActive\" AND (\"age\" < $(__p1) OR \"age\" > $(__p2)))");
            assertThat(sql("q => q.from('users').where(u => !u.isActive)"))
                .isEqualTo("SELECT * FROM \"users\" WHERE NOT \"isActive\"");
        }

        @Test
        @DisplayName("String tests become LIKE")
        void testLike() {
            assertThat(sql("q => q.from('users').where(u => u.name.startsWith('A'))"))
                .isEqualTo("SELECT * FROM \"users\" WHERE \"name\" LIKE $(__p1) || '%'");
            assertThat(sql("q => q.from('users').where(u => u.name.endsWith('z'))"))
                .isEqualTo("SELECT * FROM \"users\" WHERE \"name\" LIKE '%' || $(__p1)");
            assertThat(sql("q => q.from('users').where(u => u.name.includes('mid'))"))
                .isEqualTo("SELECT * FROM \"users\" WHERE \"name\" LIKE '%' || $(__p1) || '%'");
        }

        @Test
        @DisplayName("Case-insensitive helpers lower both sides")
        void testCaseInsensitive() {
            assertThat(sql("(q, p, h) => q.from('users').where(u => h.functions.iequals(u.name, 'bob'))"))
                .isEqualTo("SELECT * FROM \"users\" WHERE LOWER(\"name\") = LOWER($(__p1))");
            assertThat(sql("(q, p, h) => q.from('users').where(u => h.functions.icontains(u.name, 'bo'))"))
                .isEqualTo("SELECT * FROM \"users\" WHERE LOWER(\"name\") LIKE '%' || LOWER($(__p1)) || '%'");
        }

        @Test
        @DisplayName("Literal arrays become IN lists")
        void testLiteralIn() {
            assertThat(sql("q => q.from('users').where(u => [1, 2, 3].includes(u.id))"))
                .isEqualTo("SELECT * FROM \"users\" WHERE \"id\" IN ($(__p1), $(__p2), $(__p3))");
        }

        @Test
        @DisplayName("Array parameters expand to one placeholder per element")
        void testParamIn() {
            CompiledStatement stmt = postgres(
                Tinqer.defineSelect(schema, "(q, p) => q.from('users').where(u => p.ids.includes(u.id))"),
                Map.of("ids", List.of(10, 20)));

            assertThat(stmt.sql()).isEqualTo("SELECT * FROM \"users\" WHERE \"id\" IN ($(ids_0), $(ids_1))");
            assertThat(stmt.params()).containsEntry("ids_0", 10).containsEntry("ids_1", 20);
        }

        @Test
        @DisplayName("Empty IN is FALSE, empty NOT IN is TRUE")
        void testEmptyIn() {
            Map<String, Object> params = Map.of("ids", List.of());

            assertThat(sql("(q, p) => q.from('users').where(u => p.ids.includes(u.id))", params))
                .isEqualTo("SELECT * FROM \"users\" WHERE FALSE");
            assertThat(sql("(q, p) => q.from('users').where(u => !p.ids.includes(u.id))", params))
                .isEqualTo("SELECT * FROM \"users\" WHERE TRUE");
        }

        @Test
        @DisplayName("Non-array IN parameter is an error")
        void testInWithScalar() {
            SelectPlanHandle plan = Tinqer.defineSelect(schema,
                "(q, p) => q.from('users').where(u => p.ids.includes(u.id))");

            assertThatThrownBy(() -> postgres(plan, Map.of("ids", "1,2")))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("Expected array parameter 'ids' but got String");
            assertThatThrownBy(() -> postgres(plan, Map.of()))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("but got undefined");
        }

        @Test
        @DisplayName("Indexed parameters read the expanded element")
        void testIndexedParam() {
            CompiledStatement stmt = postgres(
                Tinqer.defineSelect(schema, "(q, p) => q.from('users').where(u => u.id == p.ids[1])"),
                Map.of("ids", List.of(7, 8)));

            assertThat(stmt.sql()).isEqualTo("SELECT * FROM \"users\" WHERE \"id\" = $(ids_1)");
            assertThat(stmt.params()).containsEntry("ids_1", 8);
        }
    }

    @Nested
    @DisplayName("Ordering and paging")
    class OrderingAndPaging {

        @Test
        @DisplayName("thenBy extends, a later orderBy replaces")
        void testOrderKeys() {
            assertThat(sql("q => q.from('users').orderBy(u => u.name).thenByDescending(u => u.age)"))
                .isEqualTo("SELECT * FROM \"users\" ORDER BY \"name\" ASC, \"age\" DESC");
            assertThat(sql("q => q.from('users').orderBy(u => u.name).orderBy(u => u.id)"))
                .isEqualTo("SELECT * FROM \"users\" ORDER BY \"id\" ASC");
        }

        @Test
        @DisplayName("reverse() flips every key")
        void testReverse() {
            assertThat(sql("q => q.from('users').orderBy(u => u.name).thenBy(u => u.id).reverse()"))
                .isEqualTo("SELECT * FROM \"users\" ORDER BY \"name\" DESC, \"id\" DESC");
        }

        @Test
        @DisplayName("first, single and last limits")
        void testTerminalLimits() {
            assertThat(sql("q => q.from('users').where(u => u.age > 18).first()"))
                .isEqualTo("SELECT * FROM \"users\" WHERE \"age\" > $(__p1) LIMIT 1");
            assertThat(sql("q => q.from('users').single()"))
                .isEqualTo("SELECT * FROM \"users\" LIMIT 2");
            assertThat(sql("q => q.from('users').orderBy(u => u.id).last()"))
                .isEqualTo("SELECT * FROM \"users\" ORDER BY \"id\" DESC LIMIT 1");
        }

        @Test
        @DisplayName("last() without keys orders by the first column")
        void testLastWithoutKeys() {
            assertThat(sql("q => q.from('users').last()"))
                .isEqualTo("SELECT * FROM \"users\" ORDER BY 1 DESC LIMIT 1");
            assertThat(sql("q => q.from('users').reverse().last()"))
                .isEqualTo("SELECT * FROM \"users\" ORDER BY 1 ASC LIMIT 1");
        }

        @Test
        @DisplayName("Postgres accepts OFFSET without LIMIT")
        void testSkipOnly() {
            assertThat(sql("q => q.from('users').skip(5)"))
                .isEqualTo("SELECT * FROM \"users\" OFFSET $(__p1)");
        }

        @Test
        @DisplayName("first() keeps the skip offset")
        void testFirstAfterSkip() {
            assertThat(sql("q => q.from('users').orderBy(u => u.id).skip(3).first()"))
                .isEqualTo("SELECT * FROM \"users\" ORDER BY \"id\" ASC LIMIT 1 OFFSET $(__p1)");
        }

        @Test
        @DisplayName("reverse() after take() is rejected")
        void testReverseAfterTake() {
            assertThatThrownBy(() -> sql("q => q.from('users').orderBy(u => u.id).take(5).reverse()"))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("reverse() after take/skip is not supported");
        }

        @Test
        @DisplayName("last() after take() is rejected")
        void testLastAfterTake() {
            assertThatThrownBy(() -> sql("q => q.from('users').orderBy(u => u.id).take(5).last()"))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("last() after take/skip is not supported");
        }
    }

    @Nested
    @DisplayName("Aggregates and grouping")
    class Aggregates {

        @Test
        @DisplayName("count() and count(predicate)")
        void testCount() {
            assertThat(sql("q => q.from('users').count()")).isEqualTo("SELECT COUNT(*) FROM \"users\"");
            assertThat(sql("q => q.from('users').count(u => u.isActive)"))
                .isEqualTo("SELECT COUNT(*) FROM \"users\" WHERE \"isActive\"");
        }

        @Test
        @DisplayName("count() after distinct() counts the distinct rows")
        void testDistinctCount() {
            assertThat(sql("q => q.from('users').select(u => u.city).distinct().count()"))
                .isEqualTo("SELECT COUNT(*) FROM (SELECT DISTINCT \"city\" FROM \"users\") AS \"__tinqer_distinct\"");
            assertThat(sql("q => q.from('users').where(u => u.isActive)"
                + ".select(u => ({ city: u.city, country: u.country })).distinct().count(r => r.country == 'NL')"))
                .isEqualTo("SELECT COUNT(*) FROM (SELECT DISTINCT \"city\" AS \"city\", \"country\" AS \"country\""
                    + " FROM \"users\" WHERE \"isActive\") AS \"__tinqer_distinct\" WHERE \"country\" = $(__p1)");
        }

        @Test
        @DisplayName("avg/min/max over selectors")
        void testAggregates() {
            assertThat(sql("q => q.from('orders').average(o => o.amount)"))
                .isEqualTo("SELECT AVG(\"amount\") FROM \"orders\"");
            assertThat(sql("q => q.from('orders').min(o => o.amount)"))
                .isEqualTo("SELECT MIN(\"amount\") FROM \"orders\"");
            assertThat(sql("q => q.from('orders').where(o => o.paid).max(o => o.amount)"))
                .isEqualTo("SELECT MAX(\"amount\") FROM \"orders\" WHERE \"paid\"");
        }

        @Test
        @DisplayName("min() without selector or scalar select is an error")
        void testMinWithoutSelector() {
            assertThatThrownBy(() -> sql("q => q.from('orders').min()"))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("min() requires a selector or a preceding scalar select()");
        }

        @Test
        @DisplayName("groupBy with group aggregates")
        void testGroupBy() {
            assertThat(sql("q => q.from('orders').groupBy(o => o.customerId)"
                + ".select(g => ({ customerId: g.key, total: g.sum(o => o.amount), orders: g.count() }))"))
                .isEqualTo("SELECT \"customerId\" AS \"customerId\", SUM(\"amount\") AS \"total\","
                    + " COUNT(*) AS \"orders\" FROM \"orders\" GROUP BY \"customerId\"");
        }

        @Test
        @DisplayName("groupBy without select projects the key")
        void testGroupByKeyOnly() {
            assertThat(sql("q => q.from('orders').groupBy(o => o.customerId)"))
                .isEqualTo("SELECT \"customerId\" FROM \"orders\" GROUP BY \"customerId\"");
        }
    }

    @Nested
    @DisplayName("EXISTS forms")
    class ExistsForms {

        @Test
        @DisplayName("any() with and without predicate")
        void testAny() {
            assertThat(sql("q => q.from('users').any()"))
                .isEqualTo("SELECT CASE WHEN EXISTS(SELECT 1 FROM \"users\") THEN 1 ELSE 0 END");
            assertThat(sql("q => q.from('users').any(u => u.age > 18)"))
                .isEqualTo("SELECT CASE WHEN EXISTS(SELECT 1 FROM \"users\" WHERE \"age\" > $(__p1)) THEN 1 ELSE 0 END");
        }

        @Test
        @DisplayName("all() checks that no row fails")
        void testAll() {
            assertThat(sql("q => q.from('users').where(u => u.age > 18).all(u => u.isActive)"))
                .isEqualTo("SELECT CASE WHEN NOT EXISTS(SELECT 1 FROM \"users\" WHERE \"age\" > $(__p1)"
                    + " AND NOT (\"isActive\")) THEN 1 ELSE 0 END");
        }

        @Test
        @DisplayName("contains() requires a scalar projection")
        void testContainsWithoutSelect() {
            assertThatThrownBy(() -> sql("q => q.from('users').contains(3)"))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("contains() requires a scalar .select(...) projection.");
        }
    }

    @Nested
    @DisplayName("Joins")
    class Joins {

        private static final String JOIN = "q => q.from('users')"
            + ".join(q.from('departments'), u => u.departmentId, d => d.id, (u, d) => ({ u, d }))";

        @Test
        @DisplayName("Inner join qualifies every column")
        void testInnerJoin() {
            String sql = sql(JOIN + ".where(r => r.d.name == 'Eng').select(r => ({ userName: r.u.name, dept: r.d.name }))");

            assertThat(sql).isEqualTo("SELECT \"t0\".\"name\" AS \"userName\", \"t1\".\"name\" AS \"dept\""
                + " FROM \"users\" AS \"t0\" INNER JOIN \"departments\" AS \"t1\""
                + " ON \"t0\".\"departmentId\" = \"t1\".\"id\" WHERE \"t1\".\"name\" = $(__p1)");
        }

        @Test
        @DisplayName("Join with a result selector needs a select()")
        void testJoinWithoutSelect() {
            assertThatThrownBy(() -> sql(JOIN))
                .isInstanceOf(SemanticPolicyException.class)
                .hasMessageContaining("JOIN with result selector requires explicit SELECT projection");
        }

        @Test
        @DisplayName("groupJoin + selectMany + defaultIfEmpty generates LEFT OUTER JOIN")
        void testLeftJoin() {
            String sql = sql("q => q.from('users')"
                + ".groupJoin(q.from('orders'), u => u.id, o => o.userId, (u, orders) => ({ u, orders }))"
                + ".selectMany(g => g.orders.defaultIfEmpty(), (g, o) => ({ user: g.u, order: o }))"
                + ".select(r => ({ name: r.user.name, total: r.order.total }))");

            assertThat(sql).isEqualTo("SELECT \"t0\".\"name\" AS \"name\", \"t1\".\"total\" AS \"total\""
                + " FROM \"users\" AS \"t0\" LEFT OUTER JOIN \"orders\" AS \"t1\" ON \"t0\".\"id\" = \"t1\".\"userId\"");
        }

        @Test
        @DisplayName("Independent selectMany generates CROSS JOIN")
        void testCrossJoin() {
            String sql = sql("q => q.from('users')"
                + ".selectMany(u => q.from('roles'), (u, r) => ({ user: u, role: r }))"
                + ".select(x => ({ name: x.user.name, role: x.role.title }))");

            assertThat(sql).isEqualTo("SELECT \"t0\".\"name\" AS \"name\", \"t1\".\"title\" AS \"role\""
                + " FROM \"users\" AS \"t0\" CROSS JOIN \"roles\" AS \"t1\"");
        }
    }

    @Nested
    @DisplayName("Window functions")
    class WindowFunctions {

        @Test
        @DisplayName("Filtering on a window column wraps the projection")
        void testWindowFilter() {
            String sql = sql("(q, p, h) => q.from('employees')"
                + ".select(e => ({ name: e.name, rn: h.window(e).partitionBy(r => r.dept)"
                + ".orderByDescending(r => r.salary).rowNumber() }))"
                + ".where(x => x.rn == 1)");

            assertThat(sql).isEqualTo("SELECT * FROM (SELECT \"name\" AS \"name\","
                + " ROW_NUMBER() OVER (PARTITION BY \"dept\" ORDER BY \"salary\" DESC) AS \"rn\""
                + " FROM \"employees\") AS \"__tinqer_window\" WHERE \"rn\" = $(__p1)");
        }
    }

    @Nested
    @DisplayName("Filters over computed projections")
    class ComputedProjections {

        @Test
        @DisplayName("Filtering a renamed column wraps the projection")
        void testRenamedColumnFilter() {
            assertThat(sql("q => q.from('users').select(u => ({ n: u.name, a: u.age })).where(r => r.a > 3)"))
                .isEqualTo("SELECT * FROM (SELECT \"name\" AS \"n\", \"age\" AS \"a\" FROM \"users\")"
                    + " AS \"__tinqer_projection\" WHERE \"a\" > $(__p1)");
        }

        @Test
        @DisplayName("Sorting on an aggregate wraps the grouped projection")
        void testAggregateSort() {
            assertThat(sql("q => q.from('orders').groupBy(o => o.customerId)"
                + ".select(g => ({ customerId: g.key, total: g.sum(o => o.amount) }))"
                + ".orderByDescending(r => r.total)"))
                .isEqualTo("SELECT * FROM (SELECT \"customerId\" AS \"customerId\", SUM(\"amount\") AS \"total\""
                    + " FROM \"orders\" GROUP BY \"customerId\") AS \"__tinqer_projection\" ORDER BY \"total\" DESC");
        }

        @Test
        @DisplayName("Columns kept under their own name stay at one level")
        void testPassThroughColumn() {
            assertThat(sql("q => q.from('users').select(u => ({ name: u.name, a: u.age })).where(r => r.name == 'x')"))
                .isEqualTo("SELECT \"name\" AS \"name\", \"age\" AS \"a\" FROM \"users\" WHERE \"name\" = $(__p1)");
        }
    }
}
