package com.funnelduck.funnel.breakdown;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CaseWhenExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.InExpression;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.StarExpression;
import com.funnelduck.expression.WindowFunction;
import com.funnelduck.funnel.spec.Breakdown;
import com.funnelduck.funnel.spec.BreakdownAttribution;
import com.funnelduck.funnel.spec.BreakdownType;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.logical.Join;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Project;
import com.funnelduck.types.ArrayType;
import com.funnelduck.types.TimestampType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A breakdown with its partitions discovered.
 *
 * <p>With {@link BreakdownAttribution#ALL_EVENTS}, {@link #valueColumn()} is the expression
 * the inner event query selects as {@code prop}, already folded into "Other". Other
 * attributions select the raw value as {@code prop_basic} and derive {@code prop} on top
 * of the inner query with {@link #attribute}.
 */
public final class ResolvedBreakdown {

    static final String PROP_BASIC = "prop_basic";
    static final String PROP_VALS = "prop_vals";
    static final String PROP_ATTRIBUTED = "prop_attributed";

    private final Breakdown breakdown;
    private final List<BreakdownBucket> buckets;
    private final Expression rawValue;
    private final List<Expression> keptValues;
    private final Expression otherValue;
    private final Expression emptyValue;
    private final LogicalPlan cohortRelation;
    private final Expression cohortJoinCondition;

    /**
     * @param rawValue the unfolded value of an event row
     * @param keptValues values that keep their own partition, or null when nothing folds
     * @param otherValue the "Other" value, or null when nothing folds
     * @param emptyValue the value of a row without the property ({@code ''} or a list of them)
     */
    ResolvedBreakdown(Breakdown breakdown, List<BreakdownBucket> buckets, Expression rawValue,
                      List<Expression> keptValues, Expression otherValue, Expression emptyValue,
                      LogicalPlan cohortRelation, Expression cohortJoinCondition) {
        this.breakdown = Objects.requireNonNull(breakdown, "breakdown must not be null");
        this.buckets = List.copyOf(Objects.requireNonNull(buckets, "buckets must not be null"));
        this.rawValue = Objects.requireNonNull(rawValue, "rawValue must not be null");
        this.keptValues = keptValues == null ? null : List.copyOf(keptValues);
        this.otherValue = otherValue;
        this.emptyValue = emptyValue;
        this.cohortRelation = cohortRelation;
        this.cohortJoinCondition = cohortJoinCondition;
    }

    public Breakdown breakdown() {
        return breakdown;
    }

    public List<BreakdownBucket> buckets() {
        return buckets;
    }

    public boolean hasOtherBucket() {
        return buckets.stream().anyMatch(BreakdownBucket::isOther);
    }

    /**
     * How many breakdown rows the funnel may return: one per bucket, "Other" included.
     */
    public long rowLimit() {
        return Math.max(1, buckets.size());
    }

    public boolean isCohort() {
        return breakdown.type() == BreakdownType.COHORT;
    }

    /**
     * Whether {@code prop} is derived per target rather than read from each event.
     */
    public boolean isAttributed() {
        return !isCohort() && breakdown.attribution() != BreakdownAttribution.ALL_EVENTS;
    }

    /**
     * The folded value of the scanned event row.
     */
    public Expression valueExpression() {
        return fold(rawValue);
    }

    /**
     * The breakdown column of the inner event query: {@code prop}, or {@code prop_basic}
     * when the breakdown is attributed.
     */
    public Expression valueColumn() {
        if (isAttributed()) {
            return new AliasExpression(rawValue, PROP_BASIC);
        }
        return new AliasExpression(valueExpression(), FunnelColumns.PROP);
    }

    public ColumnReference propRef() {
        return ColumnReference.of(FunnelColumns.PROP, rawValue.dataType());
    }

    /**
     * Folds values outside the kept buckets into "Other".
     */
    Expression fold(Expression value) {
        if (keptValues == null) {
            return value;
        }
        return CaseWhenExpression.when(new InExpression(value, keptValues), value, otherValue);
    }

    /**
     * Joins the cohort membership relation onto the event scan, for cohort breakdowns.
     *
     * @param events the event scan
     * @return the join, or {@code events} unchanged for property breakdowns
     */
    public LogicalPlan joinOnto(LogicalPlan events) {
        if (cohortRelation == null) {
            return events;
        }
        return new Join(events, cohortRelation, Join.JoinType.INNER, cohortJoinCondition);
    }

    /**
     * Derives {@code prop} for an attributed breakdown over the inner event query.
     *
     * <p>First and last touch give every row of a target the value of the target's
     * earliest (latest) step event that carries one:
     * <pre>
     *   SELECT *, arg_min(prop_basic, CASE WHEN &lt;any step&gt; AND prop_basic &lt;&gt; '' THEN timestamp END)
     *            OVER (PARTITION BY aggregation_target) AS prop_vals
     *   SELECT *, &lt;fold(coalesce(prop_vals, ''))&gt; AS prop
     * </pre>
     * Step attribution collects the distinct values seen on the chosen step and repeats
     * every row once per value:
     * <pre>
     *   SELECT *, list_distinct(list(CASE WHEN step_s = 1 THEN prop_basic END)
     *            OVER (PARTITION BY aggregation_target)) AS prop_vals
     *   SELECT *, unnest(prop_vals) AS prop_attributed
     *   SELECT *, &lt;fold(prop_attributed)&gt; AS prop
     * </pre>
     *
     * @param inner the inner event query, selecting {@code prop_basic} and the step columns
     * @param stepCount number of step columns
     * @return the plan with {@code prop}, or {@code inner} when the breakdown is not attributed
     */
    public LogicalPlan attribute(LogicalPlan inner, int stepCount) {
        if (!isAttributed()) {
            return inner;
        }
        ColumnReference basic = ColumnReference.of(PROP_BASIC, rawValue.dataType());
        List<Expression> target = List.of(FunnelColumns.targetRef());

        if (breakdown.attribution() == BreakdownAttribution.STEP) {
            int step = breakdown.attributionStep() == null ? 0 : breakdown.attributionStep();
            Expression stepValue = CaseWhenExpression.when(
                BinaryExpression.equal(FunnelColumns.stepRef(step), Literal.of(1)),
                basic, Literal.nullValue(rawValue.dataType()));
            ArrayType listType = ArrayType.of(rawValue.dataType());
            Expression values = FunctionCall.of("list_distinct", listType,
                new WindowFunction("list", List.of(stepValue), target, List.of(), null, listType));
            LogicalPlan withValues = extend(inner, new AliasExpression(values, PROP_VALS));
            LogicalPlan unnested = extend(withValues, new AliasExpression(
                FunctionCall.of("unnest", rawValue.dataType(), ColumnReference.of(PROP_VALS, listType)),
                PROP_ATTRIBUTED));
            return extend(unnested, new AliasExpression(
                fold(ColumnReference.of(PROP_ATTRIBUTED, rawValue.dataType())), FunnelColumns.PROP));
        }

        List<Expression> anyStep = new ArrayList<>(stepCount);
        for (int i = 0; i < stepCount; i++) {
            anyStep.add(BinaryExpression.equal(FunnelColumns.stepRef(i), Literal.of(1)));
        }
        Expression touchTime = CaseWhenExpression.when(
            BinaryExpression.and(BinaryExpression.or(anyStep), BinaryExpression.notEqual(basic, emptyValue)),
            FunnelColumns.timestampRef(), Literal.nullValue(TimestampType.get()));
        String function = breakdown.attribution() == BreakdownAttribution.FIRST_TOUCH ? "arg_min" : "arg_max";
        Expression touched = new WindowFunction(function, List.of(basic, touchTime), target, List.of(), null,
            rawValue.dataType());
        LogicalPlan withValues = extend(inner, new AliasExpression(touched, PROP_VALS));
        Expression attributed = FunctionCall.of("coalesce", rawValue.dataType(),
            ColumnReference.of(PROP_VALS, rawValue.dataType()), emptyValue);
        return extend(withValues, new AliasExpression(fold(attributed), FunnelColumns.PROP));
    }

    private static LogicalPlan extend(LogicalPlan child, Expression column) {
        return new Project(child, List.of(StarExpression.get(), column));
    }
}
