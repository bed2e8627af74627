package com.darboux.parser;

import com.darboux.expression.BinaryExpression;
import com.darboux.expression.Expression;
import com.darboux.expression.FunctionCall;
import com.darboux.expression.NumberLiteral;
import com.darboux.expression.VariableReference;
import com.darboux.functions.MathFunction;
import com.darboux.parser.PostfixParseException.ErrorKind;
import com.darboux.runtime.DarbouxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds an expression tree from postfix (Reverse Polish) tokens in a single
 * left-to-right pass over an operand stack.
 *
 * <p>Token rules, checked in this order:
 * <ul>
 *   <li>{@code x}: push a {@link VariableReference}</li>
 *   <li>{@code + - * / ^}: pop the right operand, then the left, push a {@link BinaryExpression}</li>
 *   <li>{@code sin cos tg ctg ln exp}: pop one operand, push a {@link FunctionCall}</li>
 *   <li>a decimal literal: push a {@link NumberLiteral}</li>
 * </ul>
 *
 * <p>After the last token exactly one node must remain on the stack; it is the
 * root of the tree. Every other outcome raises a {@link PostfixParseException}
 * and no partial tree is returned.
 *
 * <p>Usage:
 * <pre>
 *   PostfixParser parser = new PostfixParser();
 *   Expression tree = parser.parse("x 2 ^ x sin +");
 * </pre>
 *
 * <p>Instances hold no per-call state and may be shared between threads.
 */
public class PostfixParser {

    private static final Logger logger = LoggerFactory.getLogger(PostfixParser.class);

    /** Plain decimal literal with optional sign and exponent. */
    private static final Pattern DECIMAL_LITERAL =
        Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final int maxStackDepth;

    /**
     * Creates a parser with the default operand stack capacity.
     */
    public PostfixParser() {
        this(DarbouxConfig.DEFAULT_MAX_STACK_DEPTH);
    }

    /**
     * Creates a parser with a custom operand stack capacity.
     *
     * @param maxStackDepth the largest number of pending operands
     */
    public PostfixParser(int maxStackDepth) {
        if (maxStackDepth <= 0) {
            throw new IllegalArgumentException("maxStackDepth must be positive");
        }
        this.maxStackDepth = maxStackDepth;
    }

    /**
     * Creates a parser configured from the given settings.
     *
     * @param config the settings
     */
    public PostfixParser(DarbouxConfig config) {
        this(config.maxStackDepth());
    }

    public int maxStackDepth() {
        return maxStackDepth;
    }

    /**
     * Parses a postfix integrand.
     *
     * @param integrand space-separated postfix tokens
     * @return the root of the expression tree
     * @throws PostfixParseException if the integrand is not well-formed postfix
     */
    public Expression parse(String integrand) {
        logger.debug("Parsing postfix integrand: {}", integrand);
        return parseTokens(PostfixTokenizer.tokenize(PostfixTokenizer.normalize(integrand)));
    }

    /**
     * Parses an already tokenized integrand.
     *
     * @param tokens the tokens in input order
     * @return the root of the expression tree
     * @throws PostfixParseException if the tokens are not well-formed postfix
     */
    public Expression parseTokens(List<String> tokens) {
        if (tokens.isEmpty()) {
            throw new PostfixParseException(ErrorKind.EMPTY_EXPRESSION,
                "Expression contains no tokens", null, -1);
        }

        Deque<Expression> stack = new ArrayDeque<>();

        for (int position = 0; position < tokens.size(); position++) {
            String token = tokens.get(position);

            if (VariableReference.NAME.equals(token)) {
                push(stack, VariableReference.create(), token, position);
                continue;
            }

            Optional<BinaryExpression.Operator> operator = BinaryExpression.Operator.fromSymbol(token);
            if (operator.isPresent()) {
                Expression right = pop(stack, token, position);
                Expression left = pop(stack, token, position);
                push(stack, new BinaryExpression(left, operator.get(), right), token, position);
                continue;
            }

            Optional<MathFunction> function = MathFunction.fromName(token);
            if (function.isPresent()) {
                Expression argument = pop(stack, token, position);
                push(stack, new FunctionCall(function.get(), argument), token, position);
                continue;
            }

            push(stack, NumberLiteral.of(parseLiteral(token, position)), token, position);
        }

        if (stack.size() != 1) {
            throw new PostfixParseException(ErrorKind.SURPLUS_OPERANDS,
                "Expression leaves " + stack.size() + " values on the stack, expected exactly one",
                null, -1);
        }

        Expression root = stack.pop();
        logger.debug("Built expression tree {} with {} nodes", root, root.nodeCount());
        return root;
    }

    /**
     * Tests whether the given integrand can be parsed without errors.
     *
     * @param integrand the integrand to test
     * @return true if the integrand parses successfully, false otherwise
     */
    public boolean canParse(String integrand) {
        try {
            parse(integrand);
            return true;
        } catch (PostfixParseException e) {
            return false;
        }
    }

    private void push(Deque<Expression> stack, Expression node, String token, int position) {
        if (stack.size() >= maxStackDepth) {
            throw new PostfixParseException(ErrorKind.STACK_OVERFLOW,
                "Operand stack is full (" + maxStackDepth + " entries) at token '" + token + "'",
                token, position);
        }
        stack.push(node);
    }

    private static Expression pop(Deque<Expression> stack, String token, int position) {
        if (stack.isEmpty()) {
            throw new PostfixParseException(ErrorKind.STACK_UNDERFLOW,
                "Token '" + token + "' at position " + position + " has too few operands",
                token, position);
        }
        return stack.pop();
    }

    private static double parseLiteral(String token, int position) {
        if (!DECIMAL_LITERAL.matcher(token).matches()) {
            throw new PostfixParseException(ErrorKind.UNKNOWN_TOKEN,
                "Invalid token '" + token + "' at position " + position, token, position);
        }
        double value = Double.parseDouble(token);
        if (Double.isInfinite(value)) {
            throw new PostfixParseException(ErrorKind.UNKNOWN_TOKEN,
                "Literal '" + token + "' at position " + position + " is out of the double range",
                token, position);
        }
        return value;
    }
}
