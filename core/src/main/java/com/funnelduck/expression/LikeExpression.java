package com.funnelduck.expression;

import com.funnelduck.types.BooleanType;
import com.funnelduck.types.DataType;
import java.util.Objects;

/**
 * Expression representing a LIKE / ILIKE pattern match.
 *
 * <p>Example:
 * <pre>
 *   json_extract_string(properties, '$."$current_url"') ILIKE ?
 * </pre>
 */
public final class LikeExpression implements Expression {

    private final Expression input;
    private final Expression pattern;
    private final boolean caseInsensitive;
    private final boolean negated;

    public LikeExpression(Expression input, Expression pattern, boolean caseInsensitive, boolean negated) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.caseInsensitive = caseInsensitive;
        this.negated = negated;
    }

    public Expression input() {
        return input;
    }

    public Expression pattern() {
        return pattern;
    }

    public boolean caseInsensitive() {
        return caseInsensitive;
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * Returns the SQL keyword for this match, e.g. {@code NOT ILIKE}.
     */
    public String keyword() {
        String op = caseInsensitive ? "ILIKE" : "LIKE";
        return negated ? "NOT " + op : op;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return input.nullable() || pattern.nullable();
    }

    @Override
    public String toString() {
        return input + " " + keyword() + " " + pattern;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LikeExpression)) return false;
        LikeExpression that = (LikeExpression) obj;
        return caseInsensitive == that.caseInsensitive &&
               negated == that.negated &&
               input.equals(that.input) &&
               pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, pattern, caseInsensitive, negated);
    }
}
