package com.funnelduck.types;

/**
 * Data type representing a JSON document.
 * The event store keeps event, person and group properties in JSON columns.
 */
public final class JsonType implements DataType {

    private static final JsonType INSTANCE = new JsonType();

    private JsonType() {}

    public static JsonType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "json";
    }

    @Override
    public String duckdbName() {
        return "JSON";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof JsonType;
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
