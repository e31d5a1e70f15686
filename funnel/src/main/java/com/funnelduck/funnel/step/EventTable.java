package com.funnelduck.funnel.step;

import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.Literal;
import com.funnelduck.funnel.spec.AggregationTarget;
import com.funnelduck.funnel.spec.PropertyType;
import com.funnelduck.generator.SQLQuoting;
import com.funnelduck.types.DataType;
import com.funnelduck.types.JsonType;
import com.funnelduck.types.StringType;
import com.funnelduck.types.TimestampType;

/**
 * References into the event log table, scanned under the alias {@code e}.
 *
 * <p>Layout: {@code uuid, event, distinct_id, person_id, timestamp, properties,
 * person_properties, "$group_0".."$group_4", group0_properties..group4_properties}.
 * Property maps are JSON and read with {@code json_extract_string}.
 */
public final class EventTable {

    public static final String ALIAS = "e";

    public static final String UUID = "uuid";
    public static final String EVENT = "event";
    public static final String DISTINCT_ID = "distinct_id";
    public static final String PERSON_ID = "person_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String PROPERTIES = "properties";
    public static final String PERSON_PROPERTIES = "person_properties";

    private EventTable() {
    }

    public static ColumnReference column(String name, DataType type) {
        return ColumnReference.qualified(ALIAS, name, type);
    }

    public static ColumnReference event() {
        return column(EVENT, StringType.get());
    }

    public static ColumnReference timestamp() {
        return column(TIMESTAMP, TimestampType.get());
    }

    public static ColumnReference distinctId() {
        return column(DISTINCT_ID, StringType.get());
    }

    /**
     * The id column a funnel counts: the person id, or the group key of one group type.
     */
    public static ColumnReference aggregationTarget(AggregationTarget target) {
        if (target.isGroup()) {
            return column("$group_" + target.groupTypeIndex(), StringType.get());
        }
        return column(PERSON_ID, StringType.get());
    }

    public static ColumnReference propertiesColumn(PropertyType type, Integer groupTypeIndex) {
        switch (type) {
            case PERSON:
                return column(PERSON_PROPERTIES, JsonType.get());
            case GROUP:
                return column("group" + groupTypeIndex + "_properties", JsonType.get());
            default:
                return column(PROPERTIES, JsonType.get());
        }
    }

    /**
     * A property value as text, NULL when the key is absent.
     */
    public static Expression property(PropertyType type, Integer groupTypeIndex, String key) {
        return FunctionCall.of("json_extract_string", StringType.get(),
            propertiesColumn(type, groupTypeIndex), Literal.of(SQLQuoting.jsonKeyPath(key)));
    }
}
