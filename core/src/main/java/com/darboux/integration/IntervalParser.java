package com.darboux.integration;

import com.darboux.exception.ValidationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the textual {@code [<start> ; <end>]} interval format.
 *
 * <p>Whitespace around the bounds is optional. Bounds are decimal literals
 * read independently of the default locale; a decimal comma is not accepted.
 *
 * <p>Rejected inputs:
 * <ul>
 *   <li>{@code [ ; ]} - the interval is not defined</li>
 *   <li>anything that is not two bracketed, semicolon-separated decimals</li>
 *   <li>bounds that overflow to infinity</li>
 *   <li>equal bounds - the integral over {@code [c ; c]} is defined to be 0</li>
 * </ul>
 */
public final class IntervalParser {

    private static final String NUMBER = "[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?";

    private static final Pattern INTERVAL = Pattern.compile(
        "\\[\\s*(" + NUMBER + ")\\s*;\\s*(" + NUMBER + ")\\s*\\]");

    private static final Pattern UNDEFINED = Pattern.compile("\\[\\s*;\\s*\\]");

    private static final String PHASE = "interval validation";

    private IntervalParser() {}

    /**
     * Parses and validates an interval.
     *
     * @param text the interval text, e.g. {@code "[0 ; 2]"}
     * @return the interval, with the bounds in the entered order
     * @throws ValidationException if the interval is undefined, malformed or degenerate
     */
    public static Interval parse(String text) {
        String trimmed = text == null ? "" : text.strip();

        if (trimmed.isEmpty() || UNDEFINED.matcher(trimmed).matches()) {
            throw new ValidationException("The interval is not defined", PHASE, trimmed,
                "Enter both bounds as [start ; end]");
        }

        Matcher matcher = INTERVAL.matcher(trimmed);
        if (!matcher.matches()) {
            throw new ValidationException("Malformed interval '" + trimmed + "'", PHASE, trimmed,
                "Use the format [start ; end] with decimal bounds, e.g. [0 ; 2.5]");
        }

        double start = Double.parseDouble(matcher.group(1));
        double end = Double.parseDouble(matcher.group(2));
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            throw new ValidationException("Interval bounds must be finite", PHASE, trimmed,
                "Use bounds within the double range");
        }

        Interval interval = new Interval(start, end);
        if (interval.isDegenerate()) {
            throw new ValidationException(
                "Integrating over a [c ; c] interval is defined to be equal to 0", PHASE, trimmed,
                "Enter two different bounds");
        }
        return interval;
    }

    /**
     * Builds the interval text from its two bounds, as the history file stores it.
     *
     * @param start the start bound text
     * @param end the end bound text
     * @return the interval text {@code [start ; end]}
     */
    public static String format(String start, String end) {
        return "[" + start.strip() + " ; " + end.strip() + "]";
    }
}
