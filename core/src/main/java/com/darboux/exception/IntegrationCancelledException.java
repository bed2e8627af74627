package com.darboux.exception;

/**
 * Exception thrown when a running summation is cancelled, either explicitly
 * or because its deadline passed.
 */
public class IntegrationCancelledException extends DarbouxException {

    public IntegrationCancelledException(String message) {
        super(message);
    }

    public IntegrationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getUserMessage() {
        return "The integration was cancelled: " + getMessage() +
               ". Try a smaller refinement.";
    }
}
