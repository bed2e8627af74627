package com.darboux.parser;

import com.darboux.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a postfix integrand into tokens.
 *
 * <p>The producer of the integrand already separates tokens by single spaces,
 * so only leading and trailing whitespace is removed. Runs of spaces inside
 * the string are treated as one separator, mirroring {@code strtok}.
 */
public final class PostfixTokenizer {

    private static final String SEPARATOR = " ";

    private PostfixTokenizer() {}

    /**
     * Removes leading and trailing whitespace.
     *
     * @param raw the integrand as entered
     * @return the normalized integrand, never null
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.strip();
    }

    /**
     * Splits a normalized integrand into tokens.
     *
     * @param normalized the normalized integrand
     * @return the tokens in input order, unmodifiable
     */
    public static List<String> tokenize(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : normalized.split(SEPARATOR)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Checks the content length of a normalized integrand.
     *
     * <p>This is a length guard only; the grammar is checked by the parser.
     *
     * @param normalized the normalized integrand
     * @param maxLength the maximum accepted length in characters
     * @throws ValidationException if the integrand is longer than {@code maxLength}
     */
    public static void requireWithinLength(String normalized, int maxLength) {
        if (normalized.length() > maxLength) {
            throw new ValidationException(
                "The integrand is too long (" + normalized.length() + " characters)",
                "integrand validation",
                normalized,
                "Keep the integrand within " + maxLength + " characters"
            );
        }
    }
}
