package com.funnelduck.exception;

import com.funnelduck.expression.Expression;
import com.funnelduck.logical.LogicalPlan;

/**
 * Exception thrown when SQL rendering fails.
 *
 * <p>Rendering only fails on plan or expression nodes the renderer does not
 * know, which is a programming error in the compiler rather than a caller mistake.
 *
 * @see com.funnelduck.generator.DuckDBSQLRenderer
 */
public class SQLGenerationException extends RuntimeException {

    private final String failedNode;

    /**
     * Creates a SQL generation exception for a plan node.
     *
     * @param message the error message
     * @param plan the logical plan that failed to render
     */
    public SQLGenerationException(String message, LogicalPlan plan) {
        super(message + " (plan type: " + (plan != null ? plan.getClass().getSimpleName() : "null") + ")");
        this.failedNode = plan != null ? plan.toString() : null;
    }

    /**
     * Creates a SQL generation exception for an expression node.
     *
     * @param message the error message
     * @param expression the expression that failed to render
     */
    public SQLGenerationException(String message, Expression expression) {
        super(message + " (expression type: " +
            (expression != null ? expression.getClass().getSimpleName() : "null") + ")");
        this.failedNode = expression != null ? expression.toString() : null;
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param plan the logical plan that failed to render
     */
    public SQLGenerationException(String message, Throwable cause, LogicalPlan plan) {
        super(message + " (plan type: " + (plan != null ? plan.getClass().getSimpleName() : "null") + ")", cause);
        this.failedNode = plan != null ? plan.toString() : null;
    }

    /**
     * Returns a description of the node that failed to render.
     *
     * @return the node description, or null if not available
     */
    public String getFailedNode() {
        return failedNode;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        if (failedNode != null) {
            sb.append("Failed Node: ").append(failedNode).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
