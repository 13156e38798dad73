package com.tinqer.exception;

/**
 * Thrown by a dialect entry point when the target database cannot express a clause, such as RETURNING on SQLite.
 */
public class DialectCapabilityException extends TinqerException {

    public DialectCapabilityException(String message) {
        super(message, ErrorContext.EMPTY);
    }

    public DialectCapabilityException(String message, ErrorContext context) {
        super(message, context);
    }

    public DialectCapabilityException(String message, Throwable cause, ErrorContext context) {
        super(message, cause, context);
    }

    @Override
    protected String category() {
        return "Unsupported by dialect";
    }
}
