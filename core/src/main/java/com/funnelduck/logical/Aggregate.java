package com.funnelduck.logical;

import com.funnelduck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing an aggregation (GROUP BY clause).
 *
 * <p>The SELECT list is the grouping expressions followed by the aggregate
 * expressions, in that order, unless {@code selectGrouping} is false, in which
 * case only the aggregates are selected.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT group1, agg1 AS a FROM (child) AS subquery_N GROUP BY group1 HAVING cond
 * </pre>
 */
public final class Aggregate extends LogicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<Expression> aggregateExpressions;
    private final Expression havingCondition;
    private final boolean selectGrouping;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingExpressions the grouping expressions (empty for a global aggregate)
     * @param aggregateExpressions the aggregate expressions, usually aliased
     * @param havingCondition the HAVING condition (may be null)
     * @param selectGrouping whether grouping expressions are part of the output
     */
    public Aggregate(LogicalPlan child,
                     List<Expression> groupingExpressions,
                     List<Expression> aggregateExpressions,
                     Expression havingCondition,
                     boolean selectGrouping) {
        super(child);
        this.groupingExpressions = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null")));
        this.aggregateExpressions = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null")));
        this.havingCondition = havingCondition;
        this.selectGrouping = selectGrouping;
        if (this.aggregateExpressions.isEmpty() && (!selectGrouping || this.groupingExpressions.isEmpty())) {
            throw new IllegalArgumentException("aggregate must select at least one expression");
        }
    }

    public Aggregate(LogicalPlan child, List<Expression> groupingExpressions, List<Expression> aggregateExpressions) {
        this(child, groupingExpressions, aggregateExpressions, null, true);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<Expression> groupingExpressions() {
        return groupingExpressions;
    }

    public List<Expression> aggregateExpressions() {
        return aggregateExpressions;
    }

    /**
     * Returns the HAVING condition.
     *
     * @return the condition, or null if none
     */
    public Expression havingCondition() {
        return havingCondition;
    }

    public boolean selectGrouping() {
        return selectGrouping;
    }

    @Override
    public String toString() {
        return String.format("Aggregate(groupBy=%s, aggregates=%s%s)",
            groupingExpressions, aggregateExpressions,
            havingCondition != null ? ", having=" + havingCondition : "");
    }
}
