package com.tinqer.schema;

import com.tinqer.exception.ParseStructureException;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("Row filter config parser")
public class RowFilterConfigParserTest extends TestBase {

    @Test
    @DisplayName("Parses uniform, per-operation and disabled entries in document order")
    void testParseAllForms() {
        // Given
        String json = "{"
            + "\"users\": \"(u, ctx) => u.orgId === ctx.orgId\","
            + "\"orders\": {\"select\": \"(o, ctx) => o.ownerId === ctx.userId\", \"update\": null, \"delete\": null},"
            + "\"audit\": null"
            + "}";

        // When
        Map<String, TableRowFilter> filters = RowFilterConfigParser.parse(json);

        // Then
        assertThat(filters.keySet()).containsExactly("users", "orders", "audit");
        assertThat(filters.get("users")).isInstanceOf(TableRowFilter.Uniform.class);
        assertThat(filters.get("users").filterFor(RowFilterOperation.DELETE)).isNotNull();

        TableRowFilter orders = filters.get("orders");
        assertThat(orders).isInstanceOf(TableRowFilter.PerOperation.class);
        assertThat(orders.filterFor(RowFilterOperation.SELECT)).isNotNull();
        assertThat(orders.filterFor(RowFilterOperation.UPDATE)).isNull();
        assertThat(orders.filterFor(RowFilterOperation.DELETE)).isNull();

        assertThat(filters.get("audit")).isInstanceOf(TableRowFilter.Disabled.class);
        assertThat(filters.get("audit").filterFor(RowFilterOperation.SELECT)).isNull();
    }

    @Test
    @DisplayName("Malformed JSON is a parse error")
    void testMalformedJson() {
        assertThatThrownBy(() -> RowFilterConfigParser.parse("{\"users\": "))
            .isInstanceOf(ParseStructureException.class)
            .hasMessageContaining("Failed to parse row filter config");
    }

    @Test
    @DisplayName("Top level must be an object")
    void testNotAnObject() {
        assertThatThrownBy(() -> RowFilterConfigParser.parse("[1, 2]"))
            .isInstanceOf(ParseStructureException.class)
            .hasMessageContaining("must be a JSON object");
    }

    @Test
    @DisplayName("Blank config is rejected")
    void testBlank() {
        assertThatThrownBy(() -> RowFilterConfigParser.parse(" "))
            .isInstanceOf(ParseStructureException.class)
            .hasMessageContaining("must not be null or empty");
    }

    @Test
    @DisplayName("Per-operation entries must cover every operation")
    void testMissingOperationKey() {
        String json = "{\"orders\": {\"select\": \"(o, ctx) => o.ownerId === ctx.userId\", \"update\": null}}";

        assertThatThrownBy(() -> RowFilterConfigParser.parse(json))
            .isInstanceOf(ParseStructureException.class)
            .hasMessageContaining("Row filter config for delete must be a function or null.");
    }

    @Test
    @DisplayName("Numbers are not valid table entries")
    void testInvalidEntryType() {
        assertThatThrownBy(() -> RowFilterConfigParser.parse("{\"users\": 42}"))
            .isInstanceOf(ParseStructureException.class)
            .hasMessageContaining("must be a lambda string, an object or null");
    }

    @Test
    @DisplayName("Invalid lambda text is reported")
    void testInvalidLambda() {
        assertThatThrownBy(() -> RowFilterConfigParser.parse("{\"users\": \"u => u.orgId ===\"}"))
            .isInstanceOf(ParseStructureException.class);
    }
}
