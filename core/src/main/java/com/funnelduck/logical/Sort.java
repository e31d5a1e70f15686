package com.funnelduck.logical;

import com.funnelduck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a sort (ORDER BY clause).
 *
 * <p>SQL generation:
 * <pre>SELECT * FROM (child) AS subquery_N ORDER BY expr1 ASC NULLS LAST, expr2 DESC NULLS LAST</pre>
 *
 * <p>{@link SortOrder} is also used by window functions for their ORDER BY.
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> sortOrders;

    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        super(child);
        this.sortOrders = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(sortOrders, "sortOrders must not be null")));
        if (this.sortOrders.isEmpty()) {
            throw new IllegalArgumentException("sortOrders must not be empty");
        }
    }

    public List<SortOrder> sortOrders() {
        return sortOrders;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toString() {
        return String.format("Sort(%s)", sortOrders);
    }

    /**
     * Represents a sort order (expression + direction + null handling).
     */
    public static class SortOrder {
        private final Expression expression;
        private final SortDirection direction;
        private final NullOrdering nullOrdering;

        public SortOrder(Expression expression, SortDirection direction, NullOrdering nullOrdering) {
            this.expression = Objects.requireNonNull(expression);
            this.direction = Objects.requireNonNull(direction);
            this.nullOrdering = Objects.requireNonNull(nullOrdering);
        }

        /**
         * A sort order with DuckDB's default null placement, NULLS LAST in either direction.
         */
        public SortOrder(Expression expression, SortDirection direction) {
            this(expression, direction, NullOrdering.NULLS_LAST);
        }

        public static SortOrder asc(Expression expression) {
            return new SortOrder(expression, SortDirection.ASCENDING);
        }

        public static SortOrder desc(Expression expression) {
            return new SortOrder(expression, SortDirection.DESCENDING);
        }

        public Expression expression() {
            return expression;
        }

        public SortDirection direction() {
            return direction;
        }

        public NullOrdering nullOrdering() {
            return nullOrdering;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof SortOrder)) return false;
            SortOrder that = (SortOrder) obj;
            return expression.equals(that.expression) &&
                   direction == that.direction &&
                   nullOrdering == that.nullOrdering;
        }

        @Override
        public int hashCode() {
            return Objects.hash(expression, direction, nullOrdering);
        }

        @Override
        public String toString() {
            return String.format("%s %s %s", expression, direction, nullOrdering);
        }
    }

    /**
     * Sort direction.
     */
    public enum SortDirection {
        ASCENDING,
        DESCENDING
    }

    /**
     * Null ordering.
     */
    public enum NullOrdering {
        NULLS_FIRST,
        NULLS_LAST
    }
}
