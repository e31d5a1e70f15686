package com.funnelduck.logical;

import com.funnelduck.expression.Expression;
import java.util.Arrays;
import java.util.Objects;

/**
 * Logical plan node representing a join between two relations.
 *
 * <p>The output exposes the columns of both sides; callers qualify references
 * through the sides' aliases ({@link TableScan#alias()}, {@link AliasedRelation}).
 *
 * <p>SQL generation: {@code SELECT * FROM left INNER JOIN right ON condition}
 */
public final class Join extends LogicalPlan {

    private final JoinType joinType;
    private final Expression condition;

    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, Expression condition) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    public JoinType joinType() {
        return joinType;
    }

    public Expression condition() {
        return condition;
    }

    @Override
    public String toString() {
        return String.format("Join(%s, %s)", joinType, condition);
    }

    /**
     * Join types.
     */
    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT JOIN");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }
}
