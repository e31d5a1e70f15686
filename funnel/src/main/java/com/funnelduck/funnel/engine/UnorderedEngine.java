package com.funnelduck.funnel.engine;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.ArrayLiteralExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CaseWhenExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.window.WindowFrame;
import com.funnelduck.funnel.spec.FunnelMode;
import com.funnelduck.funnel.spec.StepDefinition;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Union;
import com.funnelduck.types.ArrayType;
import com.funnelduck.types.TimestampType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unordered funnels: a target reaches {@code k} steps when {@code k} distinct steps happen
 * within the conversion window of whichever step came first.
 *
 * <p>Each rotation of the step list (rotation {@code r} starts at step {@code r}) runs one
 * partition level over its own inner event query. The rotations are combined with UNION ALL,
 * and the step-count aggregation keeps each target's best attempt. Conversion times are
 * measured between consecutive entries of the sorted step timestamps.
 */
public class UnorderedEngine implements FunnelEngine {

    private final ExclusionEngine exclusions;

    public UnorderedEngine(ExclusionEngine exclusions) {
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions must not be null");
    }

    @Override
    public FunnelMode mode() {
        return FunnelMode.UNORDERED;
    }

    @Override
    public LogicalPlan stepsPerAttempt(FunnelContext context) {
        int stepCount = context.stepCount();
        List<LogicalPlan> rotations = new ArrayList<>(stepCount);
        for (int r = 0; r < stepCount; r++) {
            rotations.add(rotation(context, rotate(context.spec().steps(), r)));
        }
        return rotations.size() == 1 ? rotations.get(0) : new Union(rotations, true);
    }

    private LogicalPlan rotation(FunnelContext context, List<StepDefinition> order) {
        LogicalPlan inner = context.innerEventQuery(order, true);
        LogicalPlan resolved = Levels.partition(context, exclusions, inner, 1, i -> WindowFrame.unboundedPrecedingTo(0));

        Expression sortedTimes = sortedTimes(context);
        return Levels.attemptRows(context, exclusions, resolved, reachedSteps(context),
            i -> i == 0 ? FunnelColumns.latestRef(0) : listElement(sortedTimes, i + 1),
            List.of(new AliasExpression(sortedTimes, FunnelColumns.EVENT_TIMES)));
    }

    /**
     * {@code 1 + sum of [latest_0 < latest_i <= latest_0 + window]} over the other steps.
     */
    private static Expression reachedSteps(FunnelContext context) {
        ColumnReference first = FunnelColumns.latestRef(0);
        Expression windowEnd = BinaryExpression.add(first, context.window());
        Expression reached = Literal.of(1);
        for (int i = 1; i < context.stepCount(); i++) {
            ColumnReference current = FunnelColumns.latestRef(i);
            reached = BinaryExpression.add(reached, CaseWhenExpression.when(
                BinaryExpression.and(
                    BinaryExpression.lessThan(first, current),
                    BinaryExpression.lessThanOrEqual(current, windowEnd)),
                Literal.of(1),
                Literal.of(0)));
        }
        return reached;
    }

    private static Expression sortedTimes(FunnelContext context) {
        List<Expression> times = new ArrayList<>(context.stepCount());
        for (int i = 0; i < context.stepCount(); i++) {
            times.add(FunnelColumns.latestRef(i));
        }
        return FunctionCall.of("list_sort", ArrayType.of(TimestampType.get()),
            new ArrayLiteralExpression(times), Literal.of("ASC"), Literal.of("NULLS LAST"));
    }

    private static Expression listElement(Expression list, int position) {
        return FunctionCall.of("list_extract", TimestampType.get(), list, Literal.of(position));
    }

    static List<StepDefinition> rotate(List<StepDefinition> steps, int start) {
        List<StepDefinition> rotated = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            rotated.add(steps.get((start + i) % steps.size()));
        }
        return rotated;
    }

    @Override
    public Expression conversionTime(FunnelContext context, int stepIndex) {
        ColumnReference eventTimes = ColumnReference.of(FunnelColumns.EVENT_TIMES, ArrayType.of(TimestampType.get()));
        return Levels.secondsBetween(stepIndex,
            listElement(eventTimes, stepIndex), listElement(eventTimes, stepIndex + 1));
    }
}
