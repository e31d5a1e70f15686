package com.funnelduck.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when query execution fails.
 *
 * <p>This exception wraps SQLException with query context and provides
 * user-friendly error messages for common DuckDB errors. Funnel queries are
 * never retried here; the caller decides whether a failure is transient.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       QueryResult result = executor.execute(query);
 *   } catch (QueryExecutionException e) {
 *       logger.error(e.getUserMessage());
 *       logger.debug("Failed SQL: {}", e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.funnelduck.runtime.QueryExecutor
 */
public class QueryExecutionException extends RuntimeException {

    private static final Pattern COLUMN_NOT_FOUND = Pattern.compile("column \"([^\"]+)\" not found");
    private static final Pattern CONVERSION = Pattern.compile("Could not convert string '?\"?([^\"']+)\"?'? to '?([A-Z_]+)'?");

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Translates technical DuckDB error messages into actionable guidance.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();
        if (message == null) {
            return "Funnel query failed. Check the event table layout.";
        }

        if (message.contains("Binder Error") && message.contains("not found")) {
            Matcher matcher = COLUMN_NOT_FOUND.matcher(message);
            if (matcher.find()) {
                return "Column '" + matcher.group(1) + "' not found. " +
                       "Check that the event table has the expected columns.";
            }
            return "Column not found: " + message;
        }

        if (message.contains("Conversion Error")) {
            Matcher matcher = CONVERSION.matcher(message);
            if (matcher.find()) {
                return "Cannot convert value '" + matcher.group(1) + "' to type " + matcher.group(2) + ".";
            }
            return "Data type mismatch in funnel query.";
        }

        if (message.contains("Out of Memory Error")) {
            return "Funnel query requires more memory than available. " +
                   "Try a shorter date range or fewer breakdown values.";
        }

        if (message.contains("Catalog Error") && message.contains("does not exist")) {
            return "Event or cohort table not found. Check the configured table names.";
        }

        if (message.contains("Syntax Error") || message.contains("Parser Error")) {
            return "Generated SQL could not be parsed: " + message;
        }

        return "Funnel query failed: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
