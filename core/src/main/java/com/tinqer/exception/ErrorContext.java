package com.tinqer.exception;

/**
 * Where a failure happened: the statement kind, the table involved and the
 * builder method that triggered it. Any component may be null.
 *
 * @param operationKind statement or operation kind, e.g. "select", "update"
 * @param table the table name, if known
 * @param method the fluent or lambda method name, if known
 */
public record ErrorContext(String operationKind, String table, String method) {

    public static final ErrorContext EMPTY = new ErrorContext(null, null, null);

    public static ErrorContext of(String operationKind, String table, String method) {
        return new ErrorContext(operationKind, table, method);
    }

    public static ErrorContext method(String method) {
        return new ErrorContext(null, null, method);
    }

    public ErrorContext withOperationKind(String kind) {
        return new ErrorContext(kind, table, method);
    }

    public ErrorContext withTable(String newTable) {
        return new ErrorContext(operationKind, newTable, method);
    }

    public ErrorContext withMethod(String newMethod) {
        return new ErrorContext(operationKind, table, newMethod);
    }

    public boolean isEmpty() {
        return operationKind == null && table == null && method == null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (operationKind != null) {
            sb.append("operation=").append(operationKind);
        }
        if (table != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append("table=").append(table);
        }
        if (method != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append("method=").append(method);
        }
        return sb.toString();
    }
}
