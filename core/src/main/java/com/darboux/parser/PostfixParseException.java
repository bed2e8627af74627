package com.darboux.parser;

import com.darboux.exception.DarbouxException;

/**
 * Exception thrown when a postfix integrand violates the grammar.
 *
 * <p>The {@link ErrorKind} tells which rule was broken. The offending token
 * and its zero-based position are recorded when the error is tied to one
 * token; for errors detected after the last token they are {@code null}
 * and {@code -1}.
 */
public class PostfixParseException extends DarbouxException {

    /**
     * Classification of grammar errors.
     */
    public enum ErrorKind {
        /** Token is neither {@code x}, an operator, a function name nor a decimal literal */
        UNKNOWN_TOKEN("unknown token"),
        /** An operator or function found fewer operands than it needs */
        STACK_UNDERFLOW("stack underflow"),
        /** More operands are pending than the operand stack can hold */
        STACK_OVERFLOW("stack overflow"),
        /** More than one operand is left after the last token */
        SURPLUS_OPERANDS("surplus operands"),
        /** There are no tokens at all */
        EMPTY_EXPRESSION("empty expression");

        private final String description;

        ErrorKind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final ErrorKind kind;
    private final String token;
    private final int position;

    /**
     * Creates a parse exception.
     *
     * @param kind the error classification
     * @param message the error message
     * @param token the offending token (may be null)
     * @param position the zero-based token position, or -1
     */
    public PostfixParseException(ErrorKind kind, String message, String token, int position) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.position = position;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getToken() {
        return token;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public String getUserMessage() {
        switch (kind) {
            case UNKNOWN_TOKEN:
                return "Invalid token '" + token + "' in expression. " +
                       "Use x, numbers, + - * / ^ or one of sin, cos, tg, ctg, ln, exp.";
            case STACK_UNDERFLOW:
                return "Stack underflow: '" + token + "' is missing an operand. " +
                       "Enter the operands before their operator (Reverse Polish Notation).";
            case STACK_OVERFLOW:
                return "Stack overflow: too many pending operands. " +
                       "Apply operators earlier or shorten the expression.";
            case SURPLUS_OPERANDS:
                return "The expression leaves more than one value. " +
                       "Add the missing operators.";
            case EMPTY_EXPRESSION:
            default:
                return "The expression is empty.";
        }
    }

    @Override
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Postfix Parse Failed\n");
        sb.append("Kind: ").append(kind).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        if (token != null) {
            sb.append("Token: '").append(token).append("' at position ").append(position).append("\n");
        }
        return sb.toString();
    }
}
