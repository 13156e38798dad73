package com.tinqer.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.parser.LambdaSourceParser;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads row filter declarations from JSON.
 *
 * <p>Expected format:
 * <pre>
 * {
 *   "users":  "(u, ctx) => u.orgId === ctx.orgId",
 *   "orders": { "select": "(o, ctx) => o.ownerId === ctx.userId", "update": null, "delete": null },
 *   "audit":  null
 * }
 * </pre>
 */
public class RowFilterConfigParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a JSON filter map.
     *
     * @param json the JSON text
     * @return table name to filter, in document order
     * @throws ParseStructureException if the JSON or a lambda in it is invalid
     */
    public static Map<String, TableRowFilter> parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ParseStructureException("Row filter config must not be null or empty", ErrorContext.method("rowFilters"));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParseStructureException(
                "Failed to parse row filter config: " + e.getOriginalMessage(), e, ErrorContext.method("rowFilters"));
        }
        if (root == null || !root.isObject()) {
            throw new ParseStructureException("Row filter config must be a JSON object", ErrorContext.method("rowFilters"));
        }

        Map<String, TableRowFilter> filters = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            filters.put(field.getKey(), parseTable(field.getKey(), field.getValue()));
        }
        return filters;
    }

    private static TableRowFilter parseTable(String table, JsonNode node) {
        if (node.isNull()) {
            return TableRowFilter.disabled();
        }
        if (node.isTextual()) {
            return new TableRowFilter.Uniform(LambdaSourceParser.getInstance().parseLambda(node.asText()));
        }
        if (node.isObject()) {
            return new TableRowFilter.PerOperation(
                lambdaOrNull(table, node, RowFilterOperation.SELECT),
                lambdaOrNull(table, node, RowFilterOperation.UPDATE),
                lambdaOrNull(table, node, RowFilterOperation.DELETE));
        }
        throw new ParseStructureException(
            "Row filter config for table \"" + table + "\" must be a lambda string, an object or null.",
            ErrorContext.of(null, table, "rowFilters"));
    }

    private static ArrowFunctionNode lambdaOrNull(String table, JsonNode node, RowFilterOperation kind) {
        JsonNode value = node.get(kind.key());
        if (value != null && value.isNull()) {
            return null;
        }
        if (value == null || !value.isTextual()) {
            throw new ParseStructureException(
                "Row filter config for " + kind.key() + " must be a function or null.",
                ErrorContext.of(kind.key(), table, "rowFilters"));
        }
        return LambdaSourceParser.getInstance().parseLambda(value.asText());
    }

    private RowFilterConfigParser() {}
}
