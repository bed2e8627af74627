package com.darboux.evaluation;

import com.darboux.expression.BinaryExpression;
import com.darboux.expression.Expression;
import com.darboux.expression.FunctionCall;
import com.darboux.expression.NumberLiteral;
import com.darboux.expression.VariableReference;

import java.util.Objects;

/**
 * Evaluates an expression tree at a sample point.
 *
 * <p>The walk is recursive and side-effect free. No domain checks are made:
 * division by zero, the logarithm of a non-positive number or a tangent pole
 * produce NaN or an infinity, and those values propagate through the rest of
 * the arithmetic unchanged.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {}

    /**
     * Evaluates a tree for a given value of {@code x}.
     *
     * @param node the root of the tree; a {@code null} node evaluates to 0.0
     * @param x the value of the integration variable
     * @return the value of the expression
     */
    public static double evaluate(Expression node, double x) {
        if (node == null) {
            return 0.0;
        }
        if (node instanceof VariableReference) {
            return x;
        }
        if (node instanceof NumberLiteral literal) {
            return literal.value();
        }
        if (node instanceof FunctionCall call) {
            return call.function().apply(evaluate(call.argument(), x));
        }
        if (node instanceof BinaryExpression binary) {
            double left = evaluate(binary.left(), x);
            double right = evaluate(binary.right(), x);
            return binary.operator().apply(left, right);
        }
        throw new IllegalStateException("Unknown expression node: " + node.getClass().getName());
    }

    /**
     * Wraps a tree as a plain function of {@code x}.
     *
     * @param tree the root of the tree
     * @return a function sampling the tree
     */
    public static UnivariateFunction asFunction(Expression tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        return x -> evaluate(tree, x);
    }
}
