package com.funnelduck.exception;

/**
 * Exception thrown when a funnel request is invalid.
 *
 * <p>Raised during normalization and compilation, before any query executes.
 * It signals a caller mistake (an HTTP layer maps it to a 4xx response):
 * <ul>
 *   <li>Missing funnel steps</li>
 *   <li>Invalid exclusion ranges</li>
 *   <li>Unknown actions or cohorts</li>
 *   <li>Unsupported breakdown combinations</li>
 * </ul>
 */
public class FunnelConfigurationException extends RuntimeException {

    private final String field;

    /**
     * Creates a configuration exception.
     *
     * @param field the request field at fault, e.g. "exclusions[0].toStep"
     * @param message what is wrong with it
     */
    public FunnelConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /**
     * Creates a configuration exception with a cause.
     *
     * @param field the request field at fault
     * @param message what is wrong with it
     * @param cause the underlying cause
     */
    public FunnelConfigurationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    /**
     * Returns the request field at fault.
     *
     * @return the field path
     */
    public String getField() {
        return field;
    }
}
