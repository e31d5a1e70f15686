package com.funnelduck.funnel.actors;

import com.funnelduck.exception.FunnelConfigurationException;
import com.funnelduck.expression.ArrayLiteralExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.Parameter;
import com.funnelduck.funnel.engine.FunnelContext;
import com.funnelduck.funnel.engine.StepCountAggregation;
import com.funnelduck.funnel.result.DrillDownSelector;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.funnel.step.RecordingField;
import com.funnelduck.logical.Filter;
import com.funnelduck.logical.Limit;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Project;
import com.funnelduck.logical.Sort;
import com.funnelduck.types.ArrayType;
import com.funnelduck.types.StringType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the person list behind a drill-down selector.
 *
 * <pre>
 *   SELECT aggregation_target, steps[, prop][, step_i_matched_*]
 *   FROM (per-target rows) WHERE steps &gt;= k | steps = k - 1 [AND prop = value]
 *   ORDER BY aggregation_target LIMIT limit OFFSET offset
 * </pre>
 */
public class FunnelActorsQueryBuilder {

    private final StepCountAggregation aggregation;

    public FunnelActorsQueryBuilder(StepCountAggregation aggregation) {
        this.aggregation = Objects.requireNonNull(aggregation, "aggregation must not be null");
    }

    public LogicalPlan build(FunnelContext context, DrillDownSelector selector) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
        if (selector.step() > context.stepCount()) {
            throw new FunnelConfigurationException("funnelStep",
                "funnel has " + context.stepCount() + " steps, cannot select step " + selector.step());
        }

        Expression condition = selector.isDropOff()
            ? BinaryExpression.equal(FunnelColumns.stepsRef(), Literal.of(selector.step() - 1))
            : BinaryExpression.greaterThanOrEqual(FunnelColumns.stepsRef(), Literal.of(selector.step()));
        if (context.hasBreakdown() && selector.breakdownValue() != null) {
            condition = BinaryExpression.and(condition,
                BinaryExpression.equal(context.breakdown().propRef(), breakdownValue(selector.breakdownValue())));
        }

        List<Expression> columns = new ArrayList<>();
        columns.add(FunnelColumns.targetRef());
        columns.add(FunnelColumns.stepsRef());
        if (context.hasBreakdown()) {
            columns.add(context.breakdown().propRef());
        }
        for (int i = 0; i < context.stepCount(); i++) {
            for (RecordingField field : context.recordingFields()) {
                columns.add(ColumnReference.of(FunnelColumns.matched(field, i), ArrayType.of(StringType.get())));
            }
        }

        LogicalPlan selected = new Project(new Filter(aggregation.perTarget(context), condition), columns);
        LogicalPlan sorted = new Sort(selected, List.of(Sort.SortOrder.asc(FunnelColumns.targetRef())));
        Integer limit = context.spec().limit();
        long offset = context.spec().offset() == null ? 0 : context.spec().offset();
        return new Limit(sorted, limit == null ? Long.MAX_VALUE : limit, offset);
    }

    private static Expression breakdownValue(Object value) {
        if (value instanceof Number number) {
            return Literal.of(number.longValue());
        }
        if (value instanceof List<?> list) {
            List<Expression> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                elements.add(Literal.of(String.valueOf(element)));
            }
            return new ArrayLiteralExpression(elements);
        }
        return new Parameter("breakdown_value", String.valueOf(value), StringType.get());
    }
}
