package com.tinqer.visitor;

/**
 * Diagnostic record for one auto-parameter.
 *
 * @param value the literal value
 * @param fieldName the column the literal was compared with or assigned to,
 *                  or "LIMIT"/"OFFSET"; may be null
 * @param tableName the table of the enclosing query, may be null
 * @param sourceTable the join table index the column belongs to, may be null
 */
public record AutoParamInfo(Object value, String fieldName, String tableName, Integer sourceTable) {
}
