package com.tinqer.logical;

/**
 * Operation that ends a SELECT chain and fixes result cardinality or shape.
 */
public sealed interface TerminalOperation extends QueryOperation
    permits FirstOperation, SingleOperation, LastOperation, AnyOperation, AllOperation,
            ContainsOperation, CountOperation, SumOperation, AverageOperation, MinOperation,
            MaxOperation {
}
