package com.funnelduck.types;

/**
 * Data type representing a time span, produced by interval literals.
 */
public final class IntervalType implements DataType {

    private static final IntervalType INSTANCE = new IntervalType();

    private IntervalType() {}

    public static IntervalType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "interval";
    }

    @Override
    public String duckdbName() {
        return "INTERVAL";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IntervalType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
