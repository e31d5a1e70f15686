package com.funnelduck.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection settings for the embedded DuckDB engine.
 *
 * <p>Values come from system properties and fall back to defaults when a
 * property is absent or malformed:
 * <ul>
 *   <li>{@code funnelduck.duckdb.url}: JDBC URL, default {@code jdbc:duckdb:} (in-memory)</li>
 *   <li>{@code funnelduck.duckdb.threads}: worker threads, default 0 (engine default)</li>
 * </ul>
 *
 * @param jdbcUrl the JDBC URL
 * @param threads the thread count, 0 to keep the engine default
 */
public record RuntimeSettings(String jdbcUrl, int threads) {

    private static final Logger logger = LoggerFactory.getLogger(RuntimeSettings.class);

    public static final String PROP_JDBC_URL = "funnelduck.duckdb.url";
    public static final String PROP_THREADS = "funnelduck.duckdb.threads";

    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb:";
    public static final int DEFAULT_THREADS = 0;

    public RuntimeSettings {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:duckdb:")) {
            throw new IllegalArgumentException("Not a DuckDB JDBC URL: " + jdbcUrl);
        }
        if (threads < 0) {
            throw new IllegalArgumentException("threads must not be negative: " + threads);
        }
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(DEFAULT_JDBC_URL, DEFAULT_THREADS);
    }

    /**
     * Reads settings from system properties.
     *
     * @return the configured settings
     */
    public static RuntimeSettings fromSystemProperties() {
        String url = System.getProperty(PROP_JDBC_URL);
        if (url == null || !url.startsWith("jdbc:duckdb:")) {
            if (url != null) {
                logger.warn("Ignoring {}={}, not a DuckDB JDBC URL", PROP_JDBC_URL, url);
            }
            url = DEFAULT_JDBC_URL;
        }
        return new RuntimeSettings(url, getConfiguredThreads());
    }

    private static int getConfiguredThreads() {
        String value = System.getProperty(PROP_THREADS);
        if (value != null) {
            try {
                int threads = Integer.parseInt(value.trim());
                if (threads >= 0) {
                    return threads;
                }
                logger.warn("Ignoring negative {}={}", PROP_THREADS, value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}", PROP_THREADS, value);
            }
        }
        return DEFAULT_THREADS;
    }
}
