package com.bidscope.query;

/**
 * Node of a compiled predicate tree.
 *
 * <p>Nodes are immutable value objects with structural {@code equals}, so compiling the same filter
 * twice yields equal trees. Only {@link SqlRenderer} turns a tree into SQL.
 */
public interface Expression {
}
