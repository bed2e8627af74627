package com.darboux.expression;

import java.util.Objects;
import java.util.Optional;

/**
 * Expression representing a binary arithmetic operation.
 *
 * <p>Operands are stored in input order: for the postfix tokens
 * {@code a b -} the left operand is {@code a} and the right operand is
 * {@code b}. This matters for the non-commutative operators
 * {@code -}, {@code /} and {@code ^}.
 *
 * <p>Examples:
 * <pre>
 *   2 3 +          -- (2 + 3)
 *   x 1 -          -- (x - 1)
 *   x 2 ^          -- (x ^ 2)
 * </pre>
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        ADD("+", "addition"),
        SUBTRACT("-", "subtraction"),
        MULTIPLY("*", "multiplication"),
        DIVIDE("/", "division"),
        POWER("^", "exponentiation");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }

        /**
         * Applies the operator with IEEE 754 semantics.
         *
         * <p>Division by zero and {@code pow} outside its real domain yield
         * infinities or NaN rather than exceptions.
         *
         * @param left the left operand value
         * @param right the right operand value
         * @return the result
         */
        public double apply(double left, double right) {
            switch (this) {
                case ADD:
                    return left + right;
                case SUBTRACT:
                    return left - right;
                case MULTIPLY:
                    return left * right;
                case DIVIDE:
                    return left / right;
                case POWER:
                    return Math.pow(left, right);
                default:
                    throw new IllegalStateException("Unknown operator: " + this);
            }
        }

        /**
         * Resolves an operator from a token. The token must be exactly the symbol.
         *
         * @param token the token
         * @return the operator, or empty if the token is not an operator
         */
        public static Optional<Operator> fromSymbol(String token) {
            if (token == null || token.length() != 1) {
                return Optional.empty();
            }
            for (Operator op : values()) {
                if (op.symbol.equals(token)) {
                    return Optional.of(op);
                }
            }
            return Optional.empty();
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    /**
     * Returns the left operand.
     *
     * @return the left expression
     */
    public Expression left() {
        return left;
    }

    /**
     * Returns the operator.
     *
     * @return the operator
     */
    public Operator operator() {
        return operator;
    }

    /**
     * Returns the right operand.
     *
     * @return the right expression
     */
    public Expression right() {
        return right;
    }

    @Override
    public int nodeCount() {
        return 1 + left.nodeCount() + right.nodeCount();
    }

    @Override
    public String toPostfix() {
        return left.toPostfix() + " " + right.toPostfix() + " " + operator.symbol();
    }

    @Override
    public String toString() {
        return String.format("(%s %s %s)", left, operator.symbol(), right);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return Objects.equals(left, that.left) &&
               operator == that.operator &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.ADD, right);
    }

    public static BinaryExpression subtract(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.SUBTRACT, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.MULTIPLY, right);
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.DIVIDE, right);
    }

    public static BinaryExpression power(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.POWER, right);
    }
}
