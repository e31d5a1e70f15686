package com.funnelduck.funnel.step;

import com.funnelduck.expression.Expression;
import com.funnelduck.funnel.spec.PropertyType;
import com.funnelduck.types.StringType;

/**
 * Event fields carried per step so that matched events can be correlated with recordings.
 */
public enum RecordingField {
    UUID("uuid", null),
    SESSION_ID("session_id", "$session_id"),
    WINDOW_ID("window_id", "$window_id");

    private final String columnName;
    private final String propertyKey;

    RecordingField(String columnName, String propertyKey) {
        this.columnName = columnName;
        this.propertyKey = propertyKey;
    }

    public String columnName() {
        return columnName;
    }

    /**
     * The field's value on the event row being scanned.
     */
    public Expression source() {
        if (propertyKey == null) {
            return EventTable.column(EventTable.UUID, StringType.get());
        }
        return EventTable.property(PropertyType.EVENT, null, propertyKey);
    }
}
