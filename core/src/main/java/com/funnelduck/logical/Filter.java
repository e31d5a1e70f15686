package com.funnelduck.logical;

import com.funnelduck.expression.Expression;
import java.util.Objects;

/**
 * Logical plan node representing a filter (WHERE clause).
 *
 * <p>SQL generation: {@code SELECT * FROM (child) AS subquery_N WHERE condition},
 * or merged into the enclosing projection's SELECT when one sits directly on top.
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    public Filter(LogicalPlan child, Expression condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public Expression condition() {
        return condition;
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition);
    }
}
