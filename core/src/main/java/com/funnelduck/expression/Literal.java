package com.funnelduck.expression;

import com.funnelduck.types.BooleanType;
import com.funnelduck.types.DataType;
import com.funnelduck.types.DoubleType;
import com.funnelduck.types.IntegerType;
import com.funnelduck.types.LongType;
import com.funnelduck.types.StringType;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are reserved for values the compiler itself chooses (step indexes,
 * window offsets, the "Other" bucket label). Values that come from a funnel
 * request are bound through {@link Parameter} instead.
 *
 * <p>Examples in SQL:
 * <pre>
 *   SELECT 42              -- integer literal
 *   SELECT 'Other'         -- string literal
 *   SELECT TRUE            -- boolean literal
 *   SELECT NULL            -- null literal
 * </pre>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     */
    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NULL";
        }
        return dataType instanceof StringType ? "'" + value + "'" : value.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    // ==================== Factory Methods ====================

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    /**
     * Creates a NULL literal of the given type.
     *
     * @param dataType the data type
     * @return the NULL literal expression
     */
    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }
}
