package com.funnelduck.expression;

import com.funnelduck.types.ArrayType;
import com.funnelduck.types.DataType;
import com.funnelduck.types.StringType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a list constructor: {@code [e1, e2, ...]}.
 *
 * <p>Used for multi-property breakdown values and for the unordered engine's
 * sorted list of step timestamps.
 */
public final class ArrayLiteralExpression implements Expression {

    private final List<Expression> elements;
    private final DataType dataType;

    public ArrayLiteralExpression(List<Expression> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        DataType elementType = elements.isEmpty() ? StringType.get() : elements.get(0).dataType();
        this.dataType = ArrayType.of(elementType);
    }

    public List<Expression> elements() {
        return elements;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public String toString() {
        return elements.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayLiteralExpression)) return false;
        return elements.equals(((ArrayLiteralExpression) obj).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
