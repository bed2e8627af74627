package com.darboux.exception;

/**
 * Exception thrown when an integration request is rejected before any parsing
 * or summation takes place.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Integrand longer than the configured maximum</li>
 *   <li>Interval undefined ({@code [ ; ]}), malformed or degenerate ({@code [c ; c]})</li>
 *   <li>Refinement outside the configured range</li>
 * </ul>
 *
 * <p>Each instance records the validation phase that failed, the offending
 * input and a suggestion for fixing it.
 */
public class ValidationException extends DarbouxException {

    private final String phase;
    private final String invalidInput;
    private final String suggestion;

    /**
     * Creates a validation exception.
     *
     * @param message the error message
     * @param phase the validation phase, e.g. "interval validation"
     * @param invalidInput the rejected input
     * @param suggestion how to fix the input (may be null)
     */
    public ValidationException(String message, String phase, String invalidInput, String suggestion) {
        super(message);
        this.phase = phase;
        this.invalidInput = invalidInput;
        this.suggestion = suggestion;
    }

    public String getPhase() {
        return phase;
    }

    public String getInvalidInput() {
        return invalidInput;
    }

    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public String getUserMessage() {
        if (suggestion == null || suggestion.isEmpty()) {
            return getMessage();
        }
        return getMessage() + ". " + suggestion + ".";
    }

    @Override
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Validation Failed\n");
        sb.append("Phase: ").append(phase).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        sb.append("Input: ").append(invalidInput).append("\n");
        if (suggestion != null) {
            sb.append("Suggestion: ").append(suggestion).append("\n");
        }
        return sb.toString();
    }
}
