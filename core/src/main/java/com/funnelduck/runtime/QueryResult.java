package com.funnelduck.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fully materialized result of a query: column labels and rows of JDBC values.
 *
 * <p>LIST columns are converted to {@link List}s; all other values are whatever
 * the DuckDB driver returns from {@code getObject} (Long for BIGINT, Double for
 * DOUBLE, String for VARCHAR, ...).
 *
 * @param columns the column labels, in select order
 * @param rows the rows, each with one value per column
 */
public record QueryResult(List<String> columns, List<List<Object>> rows) {

    public QueryResult {
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        List<List<Object>> copy = new ArrayList<>(Objects.requireNonNull(rows, "rows must not be null").size());
        for (List<Object> row : rows) {
            // values may be null, so List.copyOf is not an option
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns the index of a column by label.
     *
     * @param label the column label
     * @return the zero-based index
     * @throws IllegalArgumentException if the column does not exist
     */
    public int columnIndex(String label) {
        int index = columns.indexOf(label);
        if (index < 0) {
            throw new IllegalArgumentException("No column '" + label + "' in " + columns);
        }
        return index;
    }
}
