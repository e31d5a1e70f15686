package com.funnelduck.expression;

import com.funnelduck.types.DataType;

/**
 * Base interface for all expressions in the funnelduck intermediate representation.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals and bound parameters</li>
 *   <li>Column references</li>
 *   <li>Arithmetic and comparison operations</li>
 *   <li>Function calls, window functions and CASE WHEN branches</li>
 * </ul>
 *
 * <p>Expressions carry no SQL text of their own. They are rendered by a
 * {@link com.funnelduck.generator.SQLRenderer}, which keeps the funnel engines
 * testable independently of the SQL dialect.
 *
 * <p>All concrete implementations in this package are immutable and {@code final}.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();
}
