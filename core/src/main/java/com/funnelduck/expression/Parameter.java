package com.funnelduck.expression;

import com.funnelduck.types.DataType;
import java.util.Objects;

/**
 * Expression representing a value bound at execution time.
 *
 * <p>Every value that originates from a funnel request (event names, property
 * keys' values, date bounds, breakdown values) enters the plan as a parameter.
 * The renderer emits a positional placeholder for each occurrence and records
 * the value, so a parameter can appear any number of times in one query.
 *
 * <p>The name is descriptive only ({@code "step_0_event"}, {@code "date_from"}):
 * two parameters with the same name and different values are legal and are
 * rendered independently.
 */
public final class Parameter implements Expression {

    private final String name;
    private final Object value;
    private final DataType dataType;

    /**
     * Creates a bound parameter.
     *
     * @param name a descriptive name, used for logging and the named parameter map
     * @param value the value to bind (must not be null; use a NULL literal instead)
     * @param dataType the data type of the value
     */
    public Parameter(String name, Object value, DataType dataType) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String name() {
        return name;
    }

    public Object value() {
        return value;
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
        return ":" + name + "=" + value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Parameter)) return false;
        Parameter that = (Parameter) obj;
        return name.equals(that.name) &&
               value.equals(that.value) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, dataType);
    }
}
