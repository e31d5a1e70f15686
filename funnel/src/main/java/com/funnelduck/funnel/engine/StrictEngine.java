package com.funnelduck.funnel.engine;

import com.funnelduck.expression.Expression;
import com.funnelduck.expression.window.WindowFrame;
import com.funnelduck.funnel.spec.FunnelMode;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.logical.LogicalPlan;

import java.util.List;
import java.util.Objects;

/**
 * Strict funnels: step {@code i} must be the event exactly {@code i} events after step 0
 * on the target's timeline, with no other event in between.
 *
 * <p>The inner query keeps every event in scope, not only step matches, and a single
 * partition level reads step {@code i} from the row {@code i} positions later.
 */
public class StrictEngine implements FunnelEngine {

    private final ExclusionEngine exclusions;

    public StrictEngine(ExclusionEngine exclusions) {
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions must not be null");
    }

    @Override
    public FunnelMode mode() {
        return FunnelMode.STRICT;
    }

    @Override
    public LogicalPlan stepsPerAttempt(FunnelContext context) {
        LogicalPlan inner = context.innerEventQuery(false);
        LogicalPlan adjacent = Levels.partition(context, exclusions, inner, 1, WindowFrame::exactlyPreceding);
        return Levels.attemptRows(context, exclusions, adjacent, Levels.orderedSteps(context),
            FunnelColumns::latestRef, List.of());
    }

    @Override
    public Expression conversionTime(FunnelContext context, int stepIndex) {
        return Levels.secondsBetween(stepIndex,
            FunnelColumns.latestRef(stepIndex - 1), FunnelColumns.latestRef(stepIndex));
    }
}
