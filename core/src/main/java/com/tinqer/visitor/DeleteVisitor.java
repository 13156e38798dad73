package com.tinqer.visitor;

import com.tinqer.logical.DeleteOperation;

/**
 * Visits {@code allowFullTableDelete}; {@code where} on a DELETE is handled
 * by {@link WhereVisitor}.
 */
class DeleteVisitor {

    DeleteOperation visitAllowFullTableDelete(DeleteOperation source) {
        return source.withAllowFullTableDelete();
    }
}
