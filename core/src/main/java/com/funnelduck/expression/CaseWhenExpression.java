package com.funnelduck.expression;

import com.funnelduck.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a searched CASE WHEN expression.
 *
 * <p>Syntax:
 * <pre>
 *   CASE
 *     WHEN condition1 THEN result1
 *     WHEN condition2 THEN result2
 *     ELSE default_result
 *   END
 * </pre>
 *
 * <p>The funnel engines use it for step flags ({@code CASE WHEN event = ? THEN 1 ELSE 0 END}),
 * for "latest timestamp if matched" columns and for the nested sorting condition
 * that yields the number of steps a person reached.
 */
public final class CaseWhenExpression implements Expression {

    private final List<Expression> conditions;
    private final List<Expression> thenBranches;
    private final Expression elseBranch;

    /**
     * Creates a CASE WHEN expression.
     *
     * @param conditions the WHEN conditions
     * @param thenBranches the THEN results, one per condition
     * @param elseBranch the ELSE result (null renders no ELSE, which yields NULL)
     */
    public CaseWhenExpression(List<Expression> conditions, List<Expression> thenBranches, Expression elseBranch) {
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(thenBranches, "thenBranches must not be null");
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("CASE WHEN requires at least one condition");
        }
        if (conditions.size() != thenBranches.size()) {
            throw new IllegalArgumentException(
                "Number of conditions (" + conditions.size() + ") must match number of THEN branches (" +
                thenBranches.size() + ")");
        }
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
        this.thenBranches = Collections.unmodifiableList(new ArrayList<>(thenBranches));
        this.elseBranch = elseBranch;
    }

    public List<Expression> conditions() {
        return conditions;
    }

    public List<Expression> thenBranches() {
        return thenBranches;
    }

    /**
     * Returns the ELSE branch.
     *
     * @return the else result, or null if there is none
     */
    public Expression elseBranch() {
        return elseBranch;
    }

    @Override
    public DataType dataType() {
        return thenBranches.get(0).dataType();
    }

    @Override
    public boolean nullable() {
        if (elseBranch == null || elseBranch.nullable()) {
            return true;
        }
        for (Expression branch : thenBranches) {
            if (branch.nullable()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CASE");
        for (int i = 0; i < conditions.size(); i++) {
            sb.append(" WHEN ").append(conditions.get(i)).append(" THEN ").append(thenBranches.get(i));
        }
        if (elseBranch != null) {
            sb.append(" ELSE ").append(elseBranch);
        }
        return sb.append(" END").toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhenExpression)) return false;
        CaseWhenExpression that = (CaseWhenExpression) obj;
        return conditions.equals(that.conditions) &&
               thenBranches.equals(that.thenBranches) &&
               Objects.equals(elseBranch, that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, thenBranches, elseBranch);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a single-branch CASE WHEN.
     *
     * @param condition the condition
     * @param then the value when the condition holds
     * @param otherwise the value otherwise
     * @return the CASE expression
     */
    public static CaseWhenExpression when(Expression condition, Expression then, Expression otherwise) {
        return new CaseWhenExpression(List.of(condition), List.of(then), otherwise);
    }
}
