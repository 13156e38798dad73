package com.tinqer.schema;

import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Unit
@DisplayName("Database schema")
public class DatabaseSchemaTest extends TestBase {

    @Test
    @DisplayName("Plain schema carries no row filters")
    void testPlain() {
        assertThat(DatabaseSchema.create().rowFilters()).isNull();
    }

    @Test
    @DisplayName("withRowFilters and withContext return new schemas")
    void testImmutable() {
        // Given
        DatabaseSchema plain = DatabaseSchema.create();
        Map<String, TableRowFilter> filters = Map.of("users", TableRowFilter.uniform("(u, ctx) => u.orgId == ctx.orgId"));

        // When
        DatabaseSchema filtered = plain.withRowFilters(filters);
        DatabaseSchema bound = filtered.withContext(Map.of("orgId", 7));

        // Then
        assertThat(plain.rowFilters()).isNull();
        assertThat(filtered.rowFilters().hasContext()).isFalse();
        assertThat(bound.rowFilters().hasContext()).isTrue();
        assertThat(bound.rowFilters().context()).containsEntry("orgId", 7);
        assertThat(bound.rowFilters().filters()).containsOnlyKeys("users");
    }

    @Test
    @DisplayName("Context is copied on bind")
    void testContextCopied() {
        Map<String, Object> context = new HashMap<>();
        context.put("orgId", 1);
        DatabaseSchema bound = DatabaseSchema.create()
            .withRowFilters(Map.of("users", TableRowFilter.disabled()))
            .withContext(context);

        context.put("orgId", 2);

        assertThat(bound.rowFilters().context()).containsEntry("orgId", 1);
    }

    @Test
    @DisplayName("withContext requires row filters")
    void testContextWithoutFilters() {
        assertThatThrownBy(() -> DatabaseSchema.create().withContext(Map.of("orgId", 1)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("withContext() requires row filters");
    }

    @Test
    @DisplayName("Per-operation factory leaves unlisted operations unfiltered")
    void testPerOperationFactory() {
        TableRowFilter filter = TableRowFilter.perOperation("(u, ctx) => u.orgId == ctx.orgId", null, null);

        assertThat(filter.filterFor(RowFilterOperation.SELECT)).isNotNull();
        assertThat(filter.filterFor(RowFilterOperation.UPDATE)).isNull();
    }
}
