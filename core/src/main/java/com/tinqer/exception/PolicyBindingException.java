package com.tinqer.exception;

/**
 * Thrown when a configured row filter cannot be applied: the context is unbound, a required context key is missing, or a table has no filter configuration. An unfiltered query would be a security defect, so this is always fatal.
 */
public class PolicyBindingException extends TinqerException {

    public PolicyBindingException(String message) {
        super(message, ErrorContext.EMPTY);
    }

    public PolicyBindingException(String message, ErrorContext context) {
        super(message, context);
    }

    public PolicyBindingException(String message, Throwable cause, ErrorContext context) {
        super(message, cause, context);
    }

    @Override
    protected String category() {
        return "Row filter binding error";
    }
}
