package com.funnelduck.logical;

import java.util.List;

/**
 * Logical plan node concatenating the rows of several inputs with the same columns.
 *
 * <p>SQL generation: {@code SELECT ... UNION ALL SELECT ... UNION ALL ...}
 */
public final class Union extends LogicalPlan {

    private final boolean all;

    /**
     * Creates a union node.
     *
     * @param inputs the inputs, at least two
     * @param all true for UNION ALL, false for UNION (duplicate removal)
     */
    public Union(List<LogicalPlan> inputs, boolean all) {
        super(inputs);
        if (inputs.size() < 2) {
            throw new IllegalArgumentException("union requires at least two inputs, got " + inputs.size());
        }
        this.all = all;
    }

    public boolean all() {
        return all;
    }

    public List<LogicalPlan> inputs() {
        return children;
    }

    @Override
    public String toString() {
        return String.format("Union(%s, inputs=%d)", all ? "ALL" : "DISTINCT", children.size());
    }
}
