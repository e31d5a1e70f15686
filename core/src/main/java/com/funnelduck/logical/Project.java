package com.funnelduck.logical;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a projection (SELECT clause).
 *
 * <p>Every funnel level is a projection: it passes some columns through and
 * recomputes others under the same names.
 *
 * <p>SQL generation:
 * <pre>SELECT expr1 AS a, expr2 AS b FROM (child) AS subquery_N</pre>
 */
public final class Project extends LogicalPlan {

    private final List<Expression> projections;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projections the projection expressions, usually {@link AliasExpression}s
     */
    public Project(LogicalPlan child, List<Expression> projections) {
        super(child);
        this.projections = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(projections, "projections must not be null")));
        if (this.projections.isEmpty()) {
            throw new IllegalArgumentException("projections must not be empty");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    public List<Expression> projections() {
        return projections;
    }

    /**
     * Returns the output column names, in order.
     *
     * <p>Aliased projections contribute their alias, bare column references their
     * column name; anything else has no stable name and contributes null.
     *
     * @return the output names
     */
    public List<String> outputNames() {
        List<String> names = new ArrayList<>(projections.size());
        for (Expression expr : projections) {
            if (expr instanceof AliasExpression alias) {
                names.add(alias.alias());
            } else if (expr instanceof ColumnReference col) {
                names.add(col.columnName());
            } else {
                names.add(null);
            }
        }
        return names;
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", outputNames());
    }
}
