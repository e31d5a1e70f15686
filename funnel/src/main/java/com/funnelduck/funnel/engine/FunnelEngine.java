package com.funnelduck.funnel.engine;

import com.funnelduck.expression.Expression;
import com.funnelduck.funnel.spec.FunnelMode;
import com.funnelduck.logical.LogicalPlan;

/**
 * Computes how far each attempt at a funnel got.
 *
 * <p>An attempt is a first-step event of a target. The plan returned by
 * {@link #stepsPerAttempt} has one row per attempt with at least
 * {@code aggregation_target}, {@code steps} (1-based number of steps reached),
 * the per-step recording columns, {@code prop} with a breakdown and
 * {@code exclusion} when exclusions apply.
 */
public interface FunnelEngine {

    FunnelMode mode();

    LogicalPlan stepsPerAttempt(FunnelContext context);

    /**
     * Seconds from step {@code stepIndex - 1} to step {@code stepIndex}, over the columns of
     * {@link #stepsPerAttempt}; NULL unless the attempt reached step {@code stepIndex}.
     */
    Expression conversionTime(FunnelContext context, int stepIndex);
}
