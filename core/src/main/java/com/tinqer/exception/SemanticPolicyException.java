package com.tinqer.exception;

/**
 * Thrown when a well-formed query is logically dangerous or unsupported, e.g. an UPDATE without WHERE, an INSERT whose values are all undefined, or reverse() after take().
 */
public class SemanticPolicyException extends TinqerException {

    public SemanticPolicyException(String message) {
        super(message, ErrorContext.EMPTY);
    }

    public SemanticPolicyException(String message, ErrorContext context) {
        super(message, context);
    }

    public SemanticPolicyException(String message, Throwable cause, ErrorContext context) {
        super(message, cause, context);
    }

    @Override
    protected String category() {
        return "Unsafe query";
    }
}
