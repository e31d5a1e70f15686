package com.funnelduck.funnel.engine;

import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.IntervalExpression;
import com.funnelduck.expression.WindowFunction;
import com.funnelduck.expression.window.WindowFrame;
import com.funnelduck.funnel.FunnelSettings;
import com.funnelduck.funnel.breakdown.ResolvedBreakdown;
import com.funnelduck.funnel.spec.ExclusionRange;
import com.funnelduck.funnel.spec.FunnelSpec;
import com.funnelduck.funnel.spec.StepDefinition;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.funnel.step.RecordingField;
import com.funnelduck.funnel.step.StepColumns;
import com.funnelduck.funnel.step.StepConditionBuilder;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Sort;
import com.funnelduck.types.DataType;
import com.funnelduck.types.StringType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything an engine needs to compile one normalized funnel.
 */
public final class FunnelContext {

    private final FunnelSpec spec;
    private final FunnelSettings settings;
    private final StepConditionBuilder stepBuilder;
    private final ResolvedBreakdown breakdown;
    private final List<ExclusionRange> exclusions;
    private final List<RecordingField> recordingFields;

    /**
     * @param spec the normalized spec
     * @param settings table names and defaults
     * @param stepBuilder compiles step predicates
     * @param breakdown the resolved breakdown, or null
     * @param exclusions the exclusions the engine applies, possibly fewer than the request names
     */
    public FunnelContext(FunnelSpec spec, FunnelSettings settings, StepConditionBuilder stepBuilder,
                         ResolvedBreakdown breakdown, List<ExclusionRange> exclusions) {
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.stepBuilder = Objects.requireNonNull(stepBuilder, "stepBuilder must not be null");
        this.breakdown = breakdown;
        this.exclusions = List.copyOf(Objects.requireNonNull(exclusions, "exclusions must not be null"));
        this.recordingFields = spec.includeRecordings() ? List.of(RecordingField.values()) : List.of();
        Objects.requireNonNull(spec.window(), "spec must be normalized");
    }

    public FunnelSpec spec() {
        return spec;
    }

    public FunnelSettings settings() {
        return settings;
    }

    public ResolvedBreakdown breakdown() {
        return breakdown;
    }

    public boolean hasBreakdown() {
        return breakdown != null;
    }

    public List<ExclusionRange> exclusions() {
        return exclusions;
    }

    public List<RecordingField> recordingFields() {
        return recordingFields;
    }

    public int stepCount() {
        return spec.stepCount();
    }

    public IntervalExpression window() {
        return spec.window().toInterval();
    }

    /**
     * Whether an event matching step {@code i - 1} can also match step {@code i}: both steps
     * match the same entity and one step's filters contain the other's. Such a step looks for
     * its event at least one row after the previous step's.
     */
    public boolean isRepeatOfPrevious(int i) {
        if (i == 0) {
            return false;
        }
        StepDefinition current = spec.steps().get(i);
        StepDefinition previous = spec.steps().get(i - 1);
        return current.isSupersetOf(previous) || previous.isSupersetOf(current);
    }

    public Expression scopeCondition() {
        return eventScope(spec);
    }

    /**
     * Date range and aggregation target condition over the event table, before a context exists.
     */
    public static Expression eventScope(FunnelSpec spec) {
        return InnerEventQuery.scopeCondition(spec.dateRange(), spec.aggregationTarget());
    }

    public List<StepColumns> stepColumns(List<StepDefinition> order) {
        List<StepColumns> columns = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            columns.add(stepBuilder.stepColumns(order.get(i), i, recordingFields));
        }
        return columns;
    }

    public List<StepColumns> exclusionColumns() {
        List<StepColumns> columns = new ArrayList<>(exclusions.size());
        for (int k = 0; k < exclusions.size(); k++) {
            columns.add(stepBuilder.exclusionColumns(exclusions.get(k), k));
        }
        return columns;
    }

    /**
     * The inner event query over the request's own step order.
     */
    public LogicalPlan innerEventQuery(boolean stepFilter) {
        return innerEventQuery(spec.steps(), stepFilter);
    }

    public LogicalPlan innerEventQuery(List<StepDefinition> order, boolean stepFilter) {
        return InnerEventQuery.build(this, stepColumns(order), exclusionColumns(), stepFilter);
    }

    /**
     * Columns every funnel row is partitioned by: the aggregation target and, with a breakdown, {@code prop}.
     */
    public List<Expression> partitionKeys() {
        List<Expression> keys = new ArrayList<>(2);
        keys.add(FunnelColumns.targetRef());
        if (breakdown != null) {
            keys.add(breakdown.propRef());
        }
        return keys;
    }

    /**
     * {@code fn(args) OVER (PARTITION BY aggregation_target[, prop] ORDER BY timestamp DESC ROWS BETWEEN ...)}
     */
    public WindowFunction overTimeline(String function, List<Expression> arguments, WindowFrame frame, DataType type) {
        return new WindowFunction(function, arguments, partitionKeys(),
            List.of(Sort.SortOrder.desc(FunnelColumns.timestampRef())), frame, type);
    }

    /**
     * Columns carried unchanged through every level.
     */
    List<Expression> identityColumns() {
        List<Expression> columns = new ArrayList<>(3);
        columns.add(FunnelColumns.timestampRef());
        columns.add(FunnelColumns.targetRef());
        if (breakdown != null) {
            columns.add(breakdown.propRef());
        }
        return columns;
    }

    ColumnReference recordingRef(RecordingField field, int index) {
        return FunnelColumns.ref(FunnelColumns.recording(field, index), StringType.get());
    }
}
