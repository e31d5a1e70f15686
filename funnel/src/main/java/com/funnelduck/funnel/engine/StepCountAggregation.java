package com.funnelduck.funnel.engine;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CaseWhenExpression;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.UnaryExpression;
import com.funnelduck.expression.WindowFunction;
import com.funnelduck.funnel.spec.FunnelSpec;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.funnel.step.RecordingField;
import com.funnelduck.logical.Aggregate;
import com.funnelduck.logical.Filter;
import com.funnelduck.logical.Limit;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Project;
import com.funnelduck.logical.Sort;
import com.funnelduck.types.ArrayType;
import com.funnelduck.types.DoubleType;
import com.funnelduck.types.IntegerType;
import com.funnelduck.types.LongType;
import com.funnelduck.types.StringType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns per-attempt rows into per-target and final step counts.
 *
 * <pre>
 *   attempts      one row per first-step event (engine specific)
 *   bestAttempts  attempts not excluded, with max_steps per target
 *   perTarget     one row per target (and breakdown value) at its best step count
 *   stepCounts    count_if(steps = n) per n, average and median conversion times
 * </pre>
 */
public class StepCountAggregation {

    private final FunnelEngine engine;
    private final ExclusionEngine exclusions;

    public StepCountAggregation(FunnelEngine engine, ExclusionEngine exclusions) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions must not be null");
    }

    public FunnelEngine engine() {
        return engine;
    }

    LogicalPlan bestAttempts(FunnelContext context) {
        LogicalPlan attempts = engine.stepsPerAttempt(context);
        if (!context.exclusions().isEmpty()) {
            attempts = new Filter(attempts, exclusions.notDisqualified());
        }

        List<Expression> columns = new ArrayList<>();
        columns.add(FunnelColumns.targetRef());
        columns.add(FunnelColumns.stepsRef());
        if (context.hasBreakdown()) {
            columns.add(context.breakdown().propRef());
        }
        for (int i = 0; i < context.stepCount(); i++) {
            for (RecordingField field : context.recordingFields()) {
                columns.add(context.recordingRef(field, i));
            }
        }
        for (int i = 1; i < context.stepCount(); i++) {
            columns.add(new AliasExpression(engine.conversionTime(context, i), FunnelColumns.conversionTime(i)));
        }
        columns.add(new AliasExpression(
            new WindowFunction("max", List.of(FunnelColumns.stepsRef()), context.partitionKeys(),
                List.of(), null, IntegerType.get()),
            FunnelColumns.MAX_STEPS));
        return new Project(attempts, columns);
    }

    /**
     * One row per target (and breakdown value): the step count it reached and the
     * average and median conversion time of each step over its best attempts.
     */
    public LogicalPlan perTarget(FunnelContext context) {
        LogicalPlan best = new Filter(bestAttempts(context),
            BinaryExpression.equal(FunnelColumns.stepsRef(), FunnelColumns.ref(FunnelColumns.MAX_STEPS, IntegerType.get())));

        List<Expression> grouping = new ArrayList<>();
        grouping.add(FunnelColumns.targetRef());
        grouping.add(FunnelColumns.stepsRef());
        if (context.hasBreakdown()) {
            grouping.add(context.breakdown().propRef());
        }

        List<Expression> aggregates = new ArrayList<>();
        for (int i = 1; i < context.stepCount(); i++) {
            aggregates.add(new AliasExpression(
                FunctionCall.of("avg", DoubleType.get(), FunnelColumns.conversionTimeRef(i)),
                FunnelColumns.averageInner(i)));
            aggregates.add(new AliasExpression(
                FunctionCall.of("median", DoubleType.get(), FunnelColumns.conversionTimeRef(i)),
                FunnelColumns.medianInner(i)));
        }
        for (int i = 0; i < context.stepCount(); i++) {
            for (RecordingField field : context.recordingFields()) {
                Expression reached = CaseWhenExpression.when(
                    BinaryExpression.greaterThan(FunnelColumns.stepsRef(), Literal.of(i)),
                    context.recordingRef(field, i),
                    null);
                aggregates.add(new AliasExpression(
                    FunctionCall.of("list_distinct", ArrayType.of(StringType.get()),
                        FunctionCall.of("list", ArrayType.of(StringType.get()), reached)),
                    FunnelColumns.matched(field, i)));
            }
        }
        return new Aggregate(best, grouping, aggregates);
    }

    /**
     * The final funnel rows: {@code step_1_count .. step_N_count}, then the average and
     * median conversion time of steps {@code 1..N-1}, then {@code prop} with a breakdown.
     * Breakdown rows are ordered by first-step count and capped at the breakdown limit;
     * the request's {@code limit} and {@code offset} page through them.
     */
    public LogicalPlan stepCounts(FunnelContext context) {
        LogicalPlan perTarget = perTarget(context);
        int stepCount = context.stepCount();

        List<Expression> columns = new ArrayList<>();
        for (int n = 1; n <= stepCount; n++) {
            columns.add(new AliasExpression(
                FunctionCall.of("count_if", LongType.get(),
                    BinaryExpression.equal(FunnelColumns.stepsRef(), Literal.of(n))),
                FunnelColumns.count(n)));
        }
        for (int i = 1; i < stepCount; i++) {
            columns.add(new AliasExpression(
                FunctionCall.of("avg", DoubleType.get(), FunnelColumns.averageInnerRef(i)),
                FunnelColumns.average(i)));
        }
        for (int i = 1; i < stepCount; i++) {
            columns.add(new AliasExpression(
                FunctionCall.of("median", DoubleType.get(), FunnelColumns.medianInnerRef(i)),
                FunnelColumns.median(i)));
        }

        if (!context.hasBreakdown()) {
            return new Aggregate(perTarget, List.of(), columns, null, false);
        }
        Expression prop = context.breakdown().propRef();
        columns.add(prop);
        LogicalPlan grouped = new Aggregate(perTarget, List.of(prop), columns, null, false);
        LogicalPlan sorted = new Sort(grouped, List.of(
            Sort.SortOrder.desc(FunnelColumns.ref(FunnelColumns.count(1), LongType.get())),
            Sort.SortOrder.asc(prop)));
        FunnelSpec spec = context.spec();
        long limit = context.breakdown().rowLimit();
        if (spec.limit() != null) {
            limit = Math.min(limit, spec.limit());
        }
        return new Limit(sorted, limit, spec.offset() == null ? 0 : spec.offset());
    }

    /**
     * Total conversion time from step {@code fromStep} to step {@code toStep} of every
     * target that reached {@code toStep}.
     */
    public LogicalPlan conversionTimes(FunnelContext context, int fromStep, int toStep) {
        if (fromStep < 0 || toStep <= fromStep || toStep >= context.stepCount()) {
            throw new IllegalArgumentException("invalid conversion range " + fromStep + " -> " + toStep);
        }
        LogicalPlan reached = new Filter(perTarget(context),
            UnaryExpression.isNotNull(FunnelColumns.averageInnerRef(toStep)));
        Expression total = null;
        for (int i = fromStep + 1; i <= toStep; i++) {
            Expression step = FunnelColumns.averageInnerRef(i);
            total = total == null ? step : BinaryExpression.add(total, step);
        }
        return new Project(reached, List.of(
            FunnelColumns.targetRef(),
            new AliasExpression(total, FunnelColumns.TOTAL_CONVERSION_TIME)));
    }
}
