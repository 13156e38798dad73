package com.tinqer.logical;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Node of a {@link ResultShape}.
 */
public sealed interface ShapeNode {

    /** A single physical column of one joined table. */
    record Column(int sourceTable, String columnName) implements ShapeNode {
        public Column {
            Objects.requireNonNull(columnName, "columnName must not be null");
        }
    }

    /** Nested object of further shape nodes. */
    record Nested(Map<String, ShapeNode> properties) implements ShapeNode {
        public Nested {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }

    /** The whole row of one joined table. */
    record Reference(int sourceTable) implements ShapeNode {
    }

    /** A collection, e.g. the group of a group join. */
    record Array(ShapeNode element) implements ShapeNode {
    }
}
