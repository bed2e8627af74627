package com.darboux.expression;

/**
 * Base interface for all nodes of a parsed integrand.
 *
 * <p>An integrand is a tree built from exactly four kinds of node:
 * <ul>
 *   <li>{@link VariableReference} - the integration variable {@code x}</li>
 *   <li>{@link NumberLiteral} - a numeric constant</li>
 *   <li>{@link FunctionCall} - one of the six unary functions applied to an argument</li>
 *   <li>{@link BinaryExpression} - one of {@code + - * / ^} applied to two operands</li>
 * </ul>
 *
 * <p>Nodes are immutable and every child has exactly one parent, so a finished
 * tree may be shared between threads without locking.
 */
public sealed interface Expression
    permits VariableReference, NumberLiteral, FunctionCall, BinaryExpression {

    /**
     * Returns the number of nodes in the subtree rooted at this node.
     *
     * <p>For a tree built from postfix input this equals the number of tokens.
     *
     * @return the node count, at least 1
     */
    int nodeCount();

    /**
     * Converts this expression back to space-separated postfix tokens.
     *
     * @return the postfix representation
     */
    String toPostfix();
}
