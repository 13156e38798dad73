package com.tinqer.exception;

/**
 * Base class of every failure raised by the query compiler.
 *
 * <p>All failures are local and synchronous; nothing inside the compiler
 * retries. Each exception carries an {@link ErrorContext} naming the
 * statement kind, table and method so callers can point users at the
 * offending part of a query.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       CompiledStatement stmt = PostgresDialect.toSql(plan, params);
 *   } catch (TinqerException e) {
 *       log.warn(e.getUserMessage());
 *       log.debug(e.getTechnicalMessage());
 *   }
 * </pre>
 */
public abstract class TinqerException extends RuntimeException {

    private final ErrorContext context;

    protected TinqerException(String message, ErrorContext context) {
        super(message);
        this.context = context != null ? context : ErrorContext.EMPTY;
    }

    protected TinqerException(String message, Throwable cause, ErrorContext context) {
        super(message, cause);
        this.context = context != null ? context : ErrorContext.EMPTY;
    }

    public ErrorContext getContext() {
        return context;
    }

    public String getOperationKind() {
        return context.operationKind();
    }

    public String getTable() {
        return context.table();
    }

    public String getMethod() {
        return context.method();
    }

    /**
     * Short category label used by {@link #getUserMessage()}.
     */
    protected abstract String category();

    /**
     * Returns a user-friendly error message including the error location.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (context.isEmpty()) {
            return category() + ": " + getMessage();
        }
        return category() + " (" + context + "): " + getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(category()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        if (context.operationKind() != null) {
            sb.append("Operation: ").append(context.operationKind()).append("\n");
        }
        if (context.table() != null) {
            sb.append("Table: ").append(context.table()).append("\n");
        }
        if (context.method() != null) {
            sb.append("Method: ").append(context.method()).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
