package com.tinqer.logical;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structure of a join or selectMany result: field name to the table and
 * column it came from. Later visitors use it to resolve chains such as
 * {@code joined.u.name} to physical columns.
 */
public record ResultShape(Map<String, ShapeNode> fields) {

    public ResultShape {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public ShapeNode get(String field) {
        return fields.get(field);
    }

    /**
     * Returns the highest table index referenced anywhere in the shape, or -1.
     */
    public int maxTableIndex() {
        int max = -1;
        for (ShapeNode node : fields.values()) {
            max = Math.max(max, maxTableIndex(node));
        }
        return max;
    }

    private static int maxTableIndex(ShapeNode node) {
        if (node instanceof ShapeNode.Column column) {
            return column.sourceTable();
        }
        if (node instanceof ShapeNode.Reference reference) {
            return reference.sourceTable();
        }
        if (node instanceof ShapeNode.Array array) {
            return maxTableIndex(array.element());
        }
        int max = -1;
        for (ShapeNode child : ((ShapeNode.Nested) node).properties().values()) {
            max = Math.max(max, maxTableIndex(child));
        }
        return max;
    }
}
