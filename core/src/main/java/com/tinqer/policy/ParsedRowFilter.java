package com.tinqer.policy;

import com.tinqer.expression.BooleanExpression;

import java.util.Map;
import java.util.Set;

/**
 * A row filter lambda turned into a predicate.
 *
 * @param predicate the predicate over the filtered table's columns
 * @param autoParams parameters minted for literals in the filter
 * @param contextKeys context keys the predicate reads
 * @param autoParamCounter the auto-parameter counter after parsing
 */
record ParsedRowFilter(BooleanExpression predicate,
                       Map<String, Object> autoParams,
                       Set<String> contextKeys,
                       int autoParamCounter) {
}
