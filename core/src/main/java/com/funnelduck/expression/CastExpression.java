package com.funnelduck.expression;

import com.funnelduck.types.DataType;
import java.util.Objects;

/**
 * Expression representing a type conversion.
 *
 * <p>A "try" cast yields NULL instead of failing when the input does not convert,
 * which is what numeric property filters need on free-form JSON properties:
 * <pre>
 *   TRY_CAST(json_extract_string(properties, '$."price"') AS DOUBLE) &gt; ?
 * </pre>
 */
public final class CastExpression implements Expression {

    private final Expression expression;
    private final DataType targetType;
    private final boolean tryCast;

    public CastExpression(Expression expression, DataType targetType, boolean tryCast) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
        this.tryCast = tryCast;
    }

    public static CastExpression tryCast(Expression expression, DataType targetType) {
        return new CastExpression(expression, targetType, true);
    }

    public Expression expression() {
        return expression;
    }

    public DataType targetType() {
        return targetType;
    }

    public boolean isTryCast() {
        return tryCast;
    }

    @Override
    public DataType dataType() {
        return targetType;
    }

    @Override
    public boolean nullable() {
        return tryCast || expression.nullable();
    }

    @Override
    public String toString() {
        return (tryCast ? "try_cast(" : "cast(") + expression + " AS " + targetType.typeName() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return tryCast == that.tryCast &&
               expression.equals(that.expression) &&
               targetType.equals(that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, targetType, tryCast);
    }
}
