package com.tinqer.exception;

/**
 * Thrown when query source has a shape the front end cannot translate: unsupported syntax, a lambda without a return, wrong arity, an unknown method or an illegal repeated call.
 */
public class ParseStructureException extends TinqerException {

    public ParseStructureException(String message) {
        super(message, ErrorContext.EMPTY);
    }

    public ParseStructureException(String message, ErrorContext context) {
        super(message, context);
    }

    public ParseStructureException(String message, Throwable cause, ErrorContext context) {
        super(message, cause, context);
    }

    @Override
    protected String category() {
        return "Query structure error";
    }
}
