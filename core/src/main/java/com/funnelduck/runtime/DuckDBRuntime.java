package com.funnelduck.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DuckDB runtime - owns a single DuckDB connection.
 *
 * <p>Each DuckDBRuntime instance manages one DuckDB connection. The runtime
 * is responsible for creating, configuring, and closing the connection.
 * A connection is not shared between threads; concurrent callers create
 * their own runtime.
 *
 * <p>Typical usage:
 * <pre>{@code
 * try (DuckDBRuntime runtime = DuckDBRuntime.create()) {
 *     QueryExecutor executor = new QueryExecutor(runtime);
 *     ...
 * }
 * }</pre>
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create("jdbc:duckdb:");
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    private final RuntimeSettings settings;
    private final DuckDBConnection connection;
    private volatile boolean closed = false;

    /**
     * Private constructor - use create() factory method.
     *
     * @param settings connection settings
     * @throws SQLException if connection fails
     */
    private DuckDBRuntime(RuntimeSettings settings) throws SQLException {
        this.settings = settings;

        logger.info("Creating DuckDB runtime with URL: {}", settings.jdbcUrl());

        Connection rawConn = DriverManager.getConnection(settings.jdbcUrl());
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        configureConnection();

        logger.info("DuckDB runtime initialized");
    }

    /**
     * Configure the connection.
     *
     * <p>Configuration includes:
     * <ul>
     *   <li>Thread count, when one is configured</li>
     *   <li>Insertion order preservation, so unsorted scans stay deterministic</li>
     *   <li>NULLS LAST as default null order, matching the funnel window ordering</li>
     * </ul>
     */
    private void configureConnection() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            if (settings.threads() > 0) {
                stmt.execute(String.format("SET threads=%d", settings.threads()));
            }

            stmt.execute("SET enable_progress_bar=false");
            stmt.execute("SET preserve_insertion_order=true");
            stmt.execute("SET default_null_order='NULLS LAST'");

            logger.debug("DuckDB configured: threads={}",
                settings.threads() > 0 ? settings.threads() : "default");
        }
    }

    /**
     * Create a new DuckDBRuntime from system property settings.
     *
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create() {
        return create(RuntimeSettings.fromSystemProperties());
    }

    /**
     * Create a new DuckDBRuntime with custom JDBC URL.
     *
     * @param jdbcUrl JDBC URL (e.g., "jdbc:duckdb:" or "jdbc:duckdb:/data/events.duckdb")
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create(String jdbcUrl) {
        return create(new RuntimeSettings(jdbcUrl, RuntimeSettings.DEFAULT_THREADS));
    }

    /**
     * Create a new DuckDBRuntime with explicit settings.
     *
     * @param settings the connection settings
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create(RuntimeSettings settings) {
        try {
            return new DuckDBRuntime(settings);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create DuckDB runtime: " + settings.jdbcUrl(), e);
        }
    }

    /**
     * Get the underlying DuckDB connection.
     *
     * <p>The connection is managed by the runtime - callers should NOT close it.
     *
     * @return the DuckDB connection
     * @throws IllegalStateException if runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    public String getJdbcUrl() {
        return settings.jdbcUrl();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the connection. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        logger.info("Closing DuckDB runtime: {}", settings.jdbcUrl());
        try {
            connection.close();
            logger.info("DuckDB connection closed");
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection", e);
        }
    }
}
