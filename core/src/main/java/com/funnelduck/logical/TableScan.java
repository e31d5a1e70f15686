package com.funnelduck.logical;

import java.util.Objects;

/**
 * Logical plan node reading a DuckDB table, optionally under an alias.
 *
 * <p>Example SQL generation:
 * <pre>
 *   TableScan("events", "e")  →  events AS e
 * </pre>
 */
public final class TableScan extends LogicalPlan {

    private final String tableName;
    private final String alias;

    /**
     * Creates a table scan node.
     *
     * @param tableName the table name
     * @param alias the alias (may be null)
     */
    public TableScan(String tableName, String alias) {
        super(); // No children
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.alias = alias;
    }

    public TableScan(String tableName) {
        this(tableName, null);
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Returns the alias of the table.
     *
     * @return the alias, or null if unaliased
     */
    public String alias() {
        return alias;
    }

    @Override
    public String toString() {
        return alias == null
            ? String.format("TableScan(%s)", tableName)
            : String.format("TableScan(%s AS %s)", tableName, alias);
    }
}
