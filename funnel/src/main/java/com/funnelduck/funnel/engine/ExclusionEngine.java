package com.funnelduck.funnel.engine;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CaseWhenExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.Literal;
import com.funnelduck.funnel.spec.ExclusionRange;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.types.IntegerType;
import com.funnelduck.types.TimestampType;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Exclusion ranges as pseudo-steps.
 *
 * <p>Exclusion {@code k} over {@code from -> to} gets a {@code exclusion_k_latest_<from>} column
 * that the levels resolve like the latest column of step {@code from + 1}, without a
 * duplicate offset. It never counts towards {@code steps}. A row is disqualified when that
 * timestamp falls strictly after step {@code from} and strictly before step {@code to}, or
 * before the end of the conversion window if step {@code to} was not reached.
 */
public class ExclusionEngine {

    /**
     * The exclusions whose latest column follows step {@code stepIndex}.
     */
    public List<Integer> carriedAt(FunnelContext context, int stepIndex) {
        List<Integer> carried = new ArrayList<>();
        List<ExclusionRange> exclusions = context.exclusions();
        for (int k = 0; k < exclusions.size(); k++) {
            if (exclusions.get(k).fromStep() + 1 == stepIndex) {
                carried.add(k);
            }
        }
        return carried;
    }

    public ColumnReference latestRef(FunnelContext context, int exclusionIndex) {
        ExclusionRange exclusion = context.exclusions().get(exclusionIndex);
        return ColumnReference.of(FunnelColumns.exclusionLatest(exclusionIndex, exclusion.fromStep()),
            TimestampType.get());
    }

    public List<Expression> latestRefs(FunnelContext context) {
        List<Expression> refs = new ArrayList<>(context.exclusions().size());
        for (int k = 0; k < context.exclusions().size(); k++) {
            refs.add(latestRef(context, k));
        }
        return refs;
    }

    /**
     * Nulls an exclusion timestamp that falls before its range starts.
     */
    public Expression dropBeforeRange(FunnelContext context, int exclusionIndex) {
        ExclusionRange exclusion = context.exclusions().get(exclusionIndex);
        ColumnReference latest = latestRef(context, exclusionIndex);
        return new AliasExpression(
            CaseWhenExpression.when(
                BinaryExpression.lessThan(latest, FunnelColumns.latestRef(exclusion.fromStep())),
                Literal.nullValue(TimestampType.get()),
                latest),
            latest.columnName());
    }

    /**
     * The {@code exclusion} column: how many exclusion ranges the row violates.
     *
     * @param context the funnel
     * @param stepTime the timestamp the row reached each step at
     * @return the aliased column, or null if there are no exclusions
     */
    public Expression disqualification(FunnelContext context, IntFunction<Expression> stepTime) {
        if (context.exclusions().isEmpty()) {
            return null;
        }
        Expression total = null;
        for (int k = 0; k < context.exclusions().size(); k++) {
            ExclusionRange exclusion = context.exclusions().get(k);
            Expression excluded = latestRef(context, k);
            Expression from = stepTime.apply(exclusion.fromStep());
            Expression until = FunctionCall.of("coalesce", TimestampType.get(),
                stepTime.apply(exclusion.toStep()),
                BinaryExpression.add(from, context.window()));
            Expression violated = CaseWhenExpression.when(
                BinaryExpression.and(
                    BinaryExpression.greaterThan(excluded, from),
                    BinaryExpression.lessThan(excluded, until)),
                Literal.of(1),
                Literal.of(0));
            total = total == null ? violated : BinaryExpression.add(total, violated);
        }
        return new AliasExpression(total, FunnelColumns.EXCLUSION);
    }

    public Expression notDisqualified() {
        return BinaryExpression.equal(ColumnReference.of(FunnelColumns.EXCLUSION, IntegerType.get()), Literal.of(0));
    }
}
