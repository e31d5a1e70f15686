package com.funnelduck.expression;

import com.funnelduck.types.BooleanType;
import com.funnelduck.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing an IN predicate.
 *
 * <p>Examples:
 * <pre>
 *   value IN (?, ?, ?)
 *   raw_prop NOT IN (?, ?)
 * </pre>
 */
public final class InExpression implements Expression {

    private final Expression testExpr;
    private final List<Expression> values;
    private final boolean negated;

    public InExpression(Expression testExpr, List<Expression> values, boolean negated) {
        this.testExpr = Objects.requireNonNull(testExpr, "testExpr must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN list must not be empty");
        }
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.negated = negated;
    }

    public InExpression(Expression testExpr, List<Expression> values) {
        this(testExpr, values, false);
    }

    public Expression testExpr() {
        return testExpr;
    }

    public List<Expression> values() {
        return values;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return testExpr.nullable();
    }

    @Override
    public String toString() {
        return testExpr + (negated ? " NOT IN " : " IN ") + values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return negated == that.negated &&
               testExpr.equals(that.testExpr) &&
               values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, values, negated);
    }
}
