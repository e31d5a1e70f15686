package com.funnelduck.runtime;

import com.funnelduck.exception.QueryExecutionException;
import com.funnelduck.generator.RenderedQuery;
import com.funnelduck.logging.QueryLogger;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Executes SQL queries against DuckDB and returns results.
 *
 * <p>Each QueryExecutor is bound to a specific {@link DuckDBRuntime}. Queries are
 * executed as prepared statements with the positional values of a
 * {@link RenderedQuery}; JDBC failures are wrapped in
 * {@link QueryExecutionException} carrying the failed SQL. Nothing is retried.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(runtime);
 *   QueryResult rows = executor.execute(renderer.render(plan));
 *   executor.executeUpdate("CREATE TABLE cohort_people (cohort_id BIGINT, distinct_id VARCHAR)");
 * </pre>
 *
 * @see DuckDBRuntime
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final DuckDBRuntime runtime;

    /**
     * Creates a query executor with the specified runtime.
     *
     * @param runtime the DuckDB runtime
     */
    public QueryExecutor(DuckDBRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    /**
     * Executes a query and materializes all rows.
     *
     * @param query the rendered query
     * @return the query result
     * @throws QueryExecutionException if query execution fails
     */
    public QueryResult execute(RenderedQuery query) throws QueryExecutionException {
        Objects.requireNonNull(query, "query must not be null");

        boolean ownsContext = QueryLogger.startQuery(QueryLogger.newQueryId());
        long queryStartTime = System.nanoTime();
        QueryLogger.logSQLGeneration(query.sql(), query.parameterCount());

        DuckDBConnection conn = runtime.getConnection();
        try (PreparedStatement stmt = conn.prepareStatement(query.sql())) {
            List<Object> params = query.parameters();
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }

            try (ResultSet rs = stmt.executeQuery()) {
                QueryResult result = collectRows(rs);
                long execTimeMs = (System.nanoTime() - queryStartTime) / 1_000_000;
                QueryLogger.logExecution(execTimeMs, result.rowCount());
                return result;
            }
        } catch (SQLException e) {
            QueryLogger.logError(e);
            throw new QueryExecutionException(
                "Failed to execute query: " + e.getMessage(), e, query.sql());
        } finally {
            if (ownsContext) {
                QueryLogger.clearContext();
            }
        }
    }

    /**
     * Executes a query without parameters.
     *
     * @param sql the SQL query to execute
     * @return the query result
     * @throws QueryExecutionException if query execution fails
     */
    public QueryResult executeQuery(String sql) throws QueryExecutionException {
        Objects.requireNonNull(sql, "sql must not be null");
        return execute(RenderedQuery.of(sql));
    }

    /**
     * Executes an update or DDL statement (INSERT, CREATE, DROP).
     *
     * @param sql the statement to execute
     * @return the number of rows affected (0 for DDL)
     * @throws QueryExecutionException if execution fails
     */
    public int executeUpdate(String sql) throws QueryExecutionException {
        Objects.requireNonNull(sql, "sql must not be null");

        DuckDBConnection conn = runtime.getConnection();
        try (Statement stmt = conn.createStatement()) {
            return stmt.executeUpdate(sql);
        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute update: " + e.getMessage(), e, sql);
        }
    }

    private QueryResult collectRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(toJava(rs.getObject(i)));
            }
            rows.add(row);
        }
        logger.debug("Collected {} rows x {} columns", rows.size(), columnCount);
        return new QueryResult(columns, rows);
    }

    private static Object toJava(Object value) throws SQLException {
        if (value instanceof Array array) {
            Object[] elements = (Object[]) array.getArray();
            List<Object> list = new ArrayList<>(elements.length);
            for (Object element : elements) {
                list.add(toJava(element));
            }
            return list;
        }
        if (value instanceof Object[] elements) {
            return new ArrayList<>(Arrays.asList(elements));
        }
        return value;
    }
}
