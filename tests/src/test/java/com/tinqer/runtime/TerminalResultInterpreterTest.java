package com.tinqer.runtime;

import com.tinqer.plan.FinalizedPlan;
import com.tinqer.plan.Tinqer;
import com.tinqer.schema.DatabaseSchema;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("TerminalResultInterpreter")
public class TerminalResultInterpreterTest extends TestBase {

    private final DatabaseSchema schema = DatabaseSchema.create();

    private FinalizedPlan plan(String query) {
        return Tinqer.defineSelect(schema, query).finalize(Map.of());
    }

    private static Map<String, Object> row(String key, Object value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(key, value);
        return row;
    }

    @Nested
    @DisplayName("Single-row terminals")
    class SingleRow {

        @Test
        @DisplayName("first() returns the first row")
        void testFirst() {
            List<Map<String, Object>> rows = List.of(row("id", 1), row("id", 2));

            assertThat(TerminalResultInterpreter.interpret(plan("q => q.from('users').first()"), rows))
                .isEqualTo(row("id", 1));
        }

        @Test
        @DisplayName("last() returns the final fetched row")
        void testLast() {
            List<Map<String, Object>> rows = List.of(row("id", 9));

            assertThat(TerminalResultInterpreter.interpret(
                plan("q => q.from('users').orderBy(u => u.id).last()"), rows)).isEqualTo(row("id", 9));
        }

        @Test
        @DisplayName("Empty result throws, OrDefault returns null")
        void testEmpty() {
            assertThatThrownBy(() -> TerminalResultInterpreter.interpret(plan("q => q.from('users').first()"), List.of()))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("No elements found for first operation");
            assertThat(TerminalResultInterpreter.interpret(
                plan("q => q.from('users').firstOrDefault()"), List.of())).isNull();
            assertThat(TerminalResultInterpreter.interpret(
                plan("q => q.from('users').singleOrDefault()"), List.of())).isNull();
        }

        @Test
        @DisplayName("single() rejects a second row")
        void testSingleMultiple() {
            List<Map<String, Object>> rows = List.of(row("id", 1), row("id", 2));

            assertThatThrownBy(() -> TerminalResultInterpreter.interpret(plan("q => q.from('users').single()"), rows))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Multiple elements found for single operation");
        }
    }

    @Nested
    @DisplayName("Scalar terminals")
    class Scalars {

        @Test
        @DisplayName("count() yields a Long")
        void testCount() {
            assertThat(TerminalResultInterpreter.interpret(plan("q => q.from('users').count()"),
                List.of(row("count", 12)))).isEqualTo(12L);
            assertThat(TerminalResultInterpreter.interpret(plan("q => q.from('users').count()"),
                List.of(row("count", "n/a")))).isEqualTo(0L);
        }

        @Test
        @DisplayName("Aggregates return the first column or null")
        void testAggregates() {
            assertThat(TerminalResultInterpreter.interpret(plan("q => q.from('orders').sum(o => o.amount)"),
                List.of(row("sum", 41.5)))).isEqualTo(41.5);
            assertThat(TerminalResultInterpreter.interpret(plan("q => q.from('orders').max(o => o.amount)"),
                List.of())).isNull();
        }

        @Test
        @DisplayName("any/all/contains coerce driver values to boolean")
        void testBooleans() {
            FinalizedPlan any = plan("q => q.from('users').any()");

            assertThat(TerminalResultInterpreter.interpret(any, List.of(row("r", 1)))).isEqualTo(true);
            assertThat(TerminalResultInterpreter.interpret(any, List.of(row("r", 0L)))).isEqualTo(false);
            assertThat(TerminalResultInterpreter.interpret(any, List.of(row("r", "0")))).isEqualTo(false);
            assertThat(TerminalResultInterpreter.interpret(any, List.of(row("r", true)))).isEqualTo(true);
            assertThat(TerminalResultInterpreter.interpret(any, List.of())).isEqualTo(false);
        }
    }

    @Test
    @DisplayName("Row queries pass the rows through")
    void testRows() {
        List<Map<String, Object>> rows = List.of(row("id", 1), row("id", 2));

        assertThat(TerminalResultInterpreter.interpret(plan("q => q.from('users').take(2)"), rows)).isSameAs(rows);
    }
}
