package com.funnelduck.funnel.engine;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CaseWhenExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.window.WindowFrame;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.funnel.step.RecordingField;
import com.funnelduck.logical.Filter;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Project;
import com.funnelduck.types.LongType;
import com.funnelduck.types.StringType;
import com.funnelduck.types.TimestampType;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Projections shared by the engines.
 *
 * <p>A partition level resolves, for each row, the earliest timestamp of every step
 * {@code i >= level} among the rows at or after it on the target's timeline. A comparison
 * level drops step timestamps that precede the previous step's timestamp, so the next
 * partition level only considers events in order.
 */
final class Levels {

    private Levels() {
    }

    /**
     * @param frameForStep the window frame of step {@code i}; rows are ordered latest first,
     *                     so {@code n PRECEDING} means n events later
     */
    static LogicalPlan partition(FunnelContext context, ExclusionEngine exclusions, LogicalPlan child,
                                 int level, IntFunction<WindowFrame> frameForStep) {
        List<Expression> columns = new ArrayList<>(context.identityColumns());
        for (int i = 0; i < context.stepCount(); i++) {
            columns.add(FunnelColumns.stepRef(i));
            if (i < level) {
                columns.addAll(passThrough(context, exclusions, i));
                continue;
            }

            WindowFrame frame = frameForStep.apply(i);
            columns.add(new AliasExpression(
                context.overTimeline("min", List.of(FunnelColumns.latestRef(i)), frame, TimestampType.get()),
                FunnelColumns.latest(i)));
            for (RecordingField field : context.recordingFields()) {
                columns.add(new AliasExpression(
                    context.overTimeline("arg_min",
                        List.of(context.recordingRef(field, i), FunnelColumns.latestRef(i)), frame, StringType.get()),
                    FunnelColumns.recording(field, i)));
            }
            for (int k : exclusions.carriedAt(context, i)) {
                ColumnReference latest = exclusions.latestRef(context, k);
                columns.add(new AliasExpression(
                    context.overTimeline("min", List.of(latest), WindowFrame.unboundedPrecedingTo(0), TimestampType.get()),
                    latest.columnName()));
            }
        }
        return new Project(child, columns);
    }

    static LogicalPlan comparison(FunnelContext context, ExclusionEngine exclusions, LogicalPlan child, int level) {
        List<Expression> columns = new ArrayList<>(context.identityColumns());
        ColumnReference reference = FunnelColumns.latestRef(level - 1);
        for (int i = 0; i < context.stepCount(); i++) {
            columns.add(FunnelColumns.stepRef(i));
            if (i < level) {
                columns.addAll(passThrough(context, exclusions, i));
                continue;
            }

            List<Expression> earlier = new ArrayList<>();
            for (int j = level; j <= i; j++) {
                earlier.add(BinaryExpression.lessThan(FunnelColumns.latestRef(j), reference));
            }
            Expression outOfOrder = BinaryExpression.or(earlier);
            columns.add(new AliasExpression(
                CaseWhenExpression.when(outOfOrder, Literal.nullValue(TimestampType.get()), FunnelColumns.latestRef(i)),
                FunnelColumns.latest(i)));
            for (RecordingField field : context.recordingFields()) {
                columns.add(new AliasExpression(
                    CaseWhenExpression.when(outOfOrder, Literal.nullValue(StringType.get()), context.recordingRef(field, i)),
                    FunnelColumns.recording(field, i)));
            }
            for (int k : exclusions.carriedAt(context, i)) {
                columns.add(exclusions.dropBeforeRange(context, k));
            }
        }
        return new Project(child, columns);
    }

    private static List<Expression> passThrough(FunnelContext context, ExclusionEngine exclusions, int i) {
        List<Expression> columns = new ArrayList<>();
        columns.add(FunnelColumns.latestRef(i));
        for (RecordingField field : context.recordingFields()) {
            columns.add(context.recordingRef(field, i));
        }
        for (int k : exclusions.carriedAt(context, i)) {
            columns.add(exclusions.latestRef(context, k));
        }
        return columns;
    }

    /**
     * One row per attempt: rows whose own event is the first step, with {@code steps} and
     * {@code exclusion} computed.
     */
    static Project attemptRows(FunnelContext context, ExclusionEngine exclusions, LogicalPlan levels,
                               Expression steps, IntFunction<Expression> stepTime, List<Expression> extraColumns) {
        List<Expression> columns = new ArrayList<>(context.identityColumns());
        for (int i = 0; i < context.stepCount(); i++) {
            columns.add(FunnelColumns.latestRef(i));
            for (RecordingField field : context.recordingFields()) {
                columns.add(context.recordingRef(field, i));
            }
        }
        columns.addAll(exclusions.latestRefs(context));
        columns.addAll(extraColumns);
        columns.add(new AliasExpression(steps, FunnelColumns.STEPS));
        Expression disqualification = exclusions.disqualification(context, stepTime);
        if (disqualification != null) {
            columns.add(disqualification);
        }
        Expression firstStep = BinaryExpression.equal(FunnelColumns.stepRef(0), Literal.of(1));
        return new Project(new Filter(levels, firstStep), columns);
    }

    /**
     * The largest {@code k} such that steps {@code 1..k-1} follow each other in order and
     * all fall within the conversion window of step 0.
     */
    static Expression orderedSteps(FunnelContext context) {
        int stepCount = context.stepCount();
        if (stepCount == 1) {
            return Literal.of(1);
        }
        List<Expression> conditions = new ArrayList<>();
        List<Expression> reached = new ArrayList<>();
        Expression windowEnd = BinaryExpression.add(FunnelColumns.latestRef(0), context.window());
        for (int k = stepCount; k >= 2; k--) {
            List<Expression> inOrder = new ArrayList<>();
            for (int i = 1; i < k; i++) {
                ColumnReference previous = FunnelColumns.latestRef(i - 1);
                ColumnReference current = FunnelColumns.latestRef(i);
                inOrder.add(context.isRepeatOfPrevious(i)
                    ? BinaryExpression.lessThan(previous, current)
                    : BinaryExpression.lessThanOrEqual(previous, current));
                inOrder.add(BinaryExpression.lessThanOrEqual(current, windowEnd));
            }
            conditions.add(BinaryExpression.and(inOrder));
            reached.add(Literal.of(k));
        }
        return new CaseWhenExpression(conditions, reached, Literal.of(1));
    }

    /**
     * {@code CASE WHEN steps > i THEN date_diff('second', from, to) END}
     */
    static Expression secondsBetween(int stepIndex, Expression from, Expression to) {
        return CaseWhenExpression.when(
            BinaryExpression.greaterThan(FunnelColumns.stepsRef(), Literal.of(stepIndex)),
            FunctionCall.of("date_diff", LongType.get(), Literal.of("second"), from, to),
            null);
    }
}
