package com.funnelduck.funnel.engine;

import com.funnelduck.expression.Expression;
import com.funnelduck.expression.window.WindowFrame;
import com.funnelduck.funnel.spec.FunnelMode;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.logical.LogicalPlan;

import java.util.List;
import java.util.Objects;

/**
 * Ordered funnels: steps must happen in order, each within the conversion window of the first.
 *
 * <p>Levels are built recursively. The innermost is a partition level over the inner event
 * query that resolves every step after step 0. Each outer level {@code L} (from
 * {@code stepCount - 1} down to 2) compares against step {@code L - 1} and resolves steps
 * {@code L..} again:
 * <pre>
 *   level(L) = partition(L, comparison(L, level(L + 1)))
 *   level(L >= stepCount) = partition(1, inner)
 * </pre>
 * A step that repeats the previous one starts its window one row later, so one event
 * cannot satisfy both.
 */
public class OrderedEngine implements FunnelEngine {

    private final ExclusionEngine exclusions;

    public OrderedEngine(ExclusionEngine exclusions) {
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions must not be null");
    }

    @Override
    public FunnelMode mode() {
        return FunnelMode.ORDERED;
    }

    @Override
    public LogicalPlan stepsPerAttempt(FunnelContext context) {
        LogicalPlan inner = context.innerEventQuery(true);
        LogicalPlan levels = level(context, inner, 2);
        return Levels.attemptRows(context, exclusions, levels, Levels.orderedSteps(context),
            FunnelColumns::latestRef, List.of());
    }

    LogicalPlan level(FunnelContext context, LogicalPlan inner, int level) {
        if (level >= context.stepCount()) {
            return Levels.partition(context, exclusions, inner, 1, i -> frame(context, i));
        }
        LogicalPlan compared = Levels.comparison(context, exclusions, level(context, inner, level + 1), level);
        return Levels.partition(context, exclusions, compared, level, i -> frame(context, i));
    }

    private static WindowFrame frame(FunnelContext context, int stepIndex) {
        return WindowFrame.unboundedPrecedingTo(context.isRepeatOfPrevious(stepIndex) ? 1 : 0);
    }

    @Override
    public Expression conversionTime(FunnelContext context, int stepIndex) {
        return Levels.secondsBetween(stepIndex,
            FunnelColumns.latestRef(stepIndex - 1), FunnelColumns.latestRef(stepIndex));
    }
}
