package com.funnelduck.types;

import java.util.Objects;

/**
 * Data type representing a list of elements of a single type.
 * Maps to DuckDB list types such as {@code VARCHAR[]}.
 *
 * <p>Multi-property breakdowns carry their value as a list of strings.
 */
public final class ArrayType implements DataType {

    private final DataType elementType;

    /**
     * Creates an array type.
     *
     * @param elementType the type of the elements
     */
    public ArrayType(DataType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
    }

    public static ArrayType of(DataType elementType) {
        return new ArrayType(elementType);
    }

    public DataType elementType() {
        return elementType;
    }

    @Override
    public String typeName() {
        return "array<" + elementType.typeName() + ">";
    }

    @Override
    public String duckdbName() {
        return elementType.duckdbName() + "[]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayType)) return false;
        return elementType.equals(((ArrayType) obj).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("array", elementType);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
