package com.funnelduck.funnel.step;

import com.funnelduck.expression.ColumnReference;
import com.funnelduck.types.DataType;
import com.funnelduck.types.DoubleType;
import com.funnelduck.types.IntegerType;
import com.funnelduck.types.LongType;
import com.funnelduck.types.StringType;
import com.funnelduck.types.TimestampType;

/**
 * Column names shared by every layer of a funnel query.
 *
 * <p>Per-step columns are suffixed with the step index ({@code step_0}, {@code latest_0}).
 * Exclusion columns carry an {@code exclusion_<k>_} prefix and the index of the step
 * the exclusion range starts at ({@code exclusion_0_latest_1}).
 */
public final class FunnelColumns {

    public static final String TIMESTAMP = "timestamp";
    public static final String AGGREGATION_TARGET = "aggregation_target";
    public static final String PROP = "prop";
    public static final String STEPS = "steps";
    public static final String MAX_STEPS = "max_steps";
    public static final String EXCLUSION = "exclusion";
    public static final String EVENT_TIMES = "event_times";
    public static final String TOTAL_CONVERSION_TIME = "total_conversion_time";

    private FunnelColumns() {
    }

    public static String exclusionPrefix(int exclusionIndex) {
        return "exclusion_" + exclusionIndex + "_";
    }

    public static String step(int index) {
        return "step_" + index;
    }

    public static String latest(int index) {
        return "latest_" + index;
    }

    public static String exclusionLatest(int exclusionIndex, int fromStep) {
        return exclusionPrefix(exclusionIndex) + latest(fromStep);
    }

    public static String recording(RecordingField field, int index) {
        return field.columnName() + "_" + index;
    }

    public static String conversionTime(int index) {
        return "step_" + index + "_conversion_time";
    }

    public static String averageInner(int index) {
        return "step_" + index + "_average_conversion_time_inner";
    }

    public static String medianInner(int index) {
        return "step_" + index + "_median_conversion_time_inner";
    }

    public static String average(int index) {
        return "step_" + index + "_average_conversion_time";
    }

    public static String median(int index) {
        return "step_" + index + "_median_conversion_time";
    }

    /**
     * Name of the final count column for the (1-based) number of steps reached.
     */
    public static String count(int stepsReached) {
        return "step_" + stepsReached + "_count";
    }

    /**
     * Distinct recording values of the targets that reached past step {@code index}.
     */
    public static String matched(RecordingField field, int index) {
        return "step_" + index + "_matched_" + field.columnName();
    }

    // ==================== References ====================

    public static ColumnReference ref(String name, DataType type) {
        return ColumnReference.of(name, type);
    }

    public static ColumnReference timestampRef() {
        return ref(TIMESTAMP, TimestampType.get());
    }

    public static ColumnReference targetRef() {
        return ref(AGGREGATION_TARGET, StringType.get());
    }

    public static ColumnReference stepsRef() {
        return ref(STEPS, IntegerType.get());
    }

    public static ColumnReference stepRef(int index) {
        return ref(step(index), IntegerType.get());
    }

    public static ColumnReference latestRef(int index) {
        return ref(latest(index), TimestampType.get());
    }

    public static ColumnReference conversionTimeRef(int index) {
        return ref(conversionTime(index), LongType.get());
    }

    public static ColumnReference averageInnerRef(int index) {
        return ref(averageInner(index), DoubleType.get());
    }

    public static ColumnReference medianInnerRef(int index) {
        return ref(medianInner(index), DoubleType.get());
    }
}
