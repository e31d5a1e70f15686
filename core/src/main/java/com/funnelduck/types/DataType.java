package com.funnelduck.types;

/**
 * Sealed interface for the data types carried by funnelduck expressions.
 *
 * <p>The type system is intentionally small: it only covers what the funnel
 * compiler emits and what the DuckDB event store exposes.
 * <ul>
 *   <li>Primitive types: BooleanType, IntegerType, LongType, DoubleType, StringType</li>
 *   <li>Temporal types: TimestampType, IntervalType</li>
 *   <li>Complex types: ArrayType, JsonType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, DoubleType, StringType,
            TimestampType, IntervalType, ArrayType, JsonType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the DuckDB SQL name of this type, as used in CAST expressions.
     *
     * @return the DuckDB type name
     */
    String duckdbName();
}
