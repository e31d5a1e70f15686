package com.funnelduck.expression;

import com.funnelduck.types.StringType;
import com.funnelduck.types.DataType;

/**
 * Expression representing {@code *}, either as a projection or as the argument of {@code count(*)}.
 */
public final class StarExpression implements Expression {

    private static final StarExpression INSTANCE = new StarExpression();

    private StarExpression() {
    }

    public static StarExpression get() {
        return INSTANCE;
    }

    @Override
    public DataType dataType() {
        return StringType.get();
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public String toString() {
        return "*";
    }
}
