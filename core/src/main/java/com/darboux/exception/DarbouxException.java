package com.darboux.exception;

/**
 * Base type for all errors raised while preparing or running an integration.
 *
 * <p>Subclasses carry enough context to produce two renderings of the same
 * failure: a short message for the person at the console, and a detailed one
 * for the log.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       IntegrationResult result = integrator.integrate(integrand, interval, 1000);
 *   } catch (DarbouxException e) {
 *       System.err.println(e.getUserMessage());
 *       logger.debug(e.getTechnicalMessage());
 *   }
 * </pre>
 */
public class DarbouxException extends RuntimeException {

    public DarbouxException(String message) {
        super(message);
    }

    public DarbouxException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return the message shown at the console
     */
    public String getUserMessage() {
        return getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append(": ").append(getMessage()).append("\n");
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
