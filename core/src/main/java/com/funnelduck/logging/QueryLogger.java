package com.funnelduck.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for funnel query compilation and execution.
 *
 * <p>A query id is placed in the SLF4J MDC under {@value #QUERY_ID_KEY} so that
 * the compile, ranking and execution lines of one funnel share a correlation id.
 * SQL text is logged at DEBUG, timings at INFO.
 *
 * <p>Typical usage:
 * <pre>
 *   QueryLogger.startQuery(QueryLogger.newQueryId());
 *   try {
 *       ...
 *       QueryLogger.logExecution(elapsedMs, rows);
 *   } finally {
 *       QueryLogger.clearContext();
 *   }
 * </pre>
 */
public final class QueryLogger {

    private static final Logger logger = LoggerFactory.getLogger(QueryLogger.class);

    public static final String QUERY_ID_KEY = "queryId";

    private QueryLogger() {
    }

    /**
     * Returns a short random query id, e.g. {@code q_1a2b3c4d}.
     */
    public static String newQueryId() {
        return "q_" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Starts a logging context, unless one is already active.
     *
     * @param queryId the correlation id
     * @return true if this call opened the context and must clear it
     */
    public static boolean startQuery(String queryId) {
        if (MDC.get(QUERY_ID_KEY) != null) {
            return false;
        }
        MDC.put(QUERY_ID_KEY, queryId);
        logger.debug("Query started");
        return true;
    }

    public static String currentQueryId() {
        return MDC.get(QUERY_ID_KEY);
    }

    public static void logCompilation(String description, long elapsedMs) {
        logger.info("Compiled {} in {} ms", description, elapsedMs);
    }

    public static void logSQLGeneration(String sql, int parameterCount) {
        if (logger.isDebugEnabled()) {
            logger.debug("Generated SQL ({} parameters):\n{}", parameterCount, sql);
        }
    }

    public static void logExecution(long elapsedMs, long rowCount) {
        logger.info("Executed in {} ms, {} rows", elapsedMs, rowCount);
    }

    public static void logError(Throwable error) {
        logger.error("Query failed: {}", error.getMessage());
    }

    /**
     * Removes the query id from the MDC.
     */
    public static void clearContext() {
        MDC.remove(QUERY_ID_KEY);
    }
}
