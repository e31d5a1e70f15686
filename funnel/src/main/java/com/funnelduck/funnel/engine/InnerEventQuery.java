package com.funnelduck.funnel.engine;

import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.CastExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.Parameter;
import com.funnelduck.expression.UnaryExpression;
import com.funnelduck.funnel.FunnelSettings;
import com.funnelduck.funnel.spec.AggregationTarget;
import com.funnelduck.funnel.spec.DateRange;
import com.funnelduck.funnel.step.EventTable;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.funnel.step.StepColumns;
import com.funnelduck.logical.Filter;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Project;
import com.funnelduck.logical.TableScan;
import com.funnelduck.types.StringType;
import com.funnelduck.types.TimestampType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * The per-event query every funnel engine starts from: one row per event in scope,
 * with the step and exclusion columns and the breakdown value.
 *
 * <pre>
 *   SELECT e."timestamp" AS "timestamp", e.person_id AS aggregation_target,
 *          CASE WHEN ... THEN 1 ELSE 0 END AS step_0, ..., &lt;breakdown&gt; AS prop
 *   FROM events AS e [INNER JOIN (...) AS cohort_join ON ...]
 *   WHERE &lt;date range&gt; AND aggregation target is set [AND (&lt;step 0&gt; OR &lt;step 1&gt; ...)]
 * </pre>
 * An attributed breakdown selects {@code prop_basic} here and wraps the query to derive {@code prop}.
 */
final class InnerEventQuery {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private InnerEventQuery() {
    }

    /**
     * Restricts events to the date range and to rows that carry an aggregation target.
     */
    static Expression scopeCondition(DateRange dateRange, AggregationTarget target) {
        List<Expression> conditions = new ArrayList<>();
        if (dateRange.from() != null) {
            conditions.add(BinaryExpression.greaterThanOrEqual(EventTable.timestamp(),
                timestampParameter("date_from", dateRange.from())));
        }
        if (dateRange.to() != null) {
            conditions.add(BinaryExpression.lessThanOrEqual(EventTable.timestamp(),
                timestampParameter("date_to", dateRange.to())));
        }
        ColumnReference targetColumn = EventTable.aggregationTarget(target);
        conditions.add(UnaryExpression.isNotNull(targetColumn));
        if (target.isGroup()) {
            conditions.add(BinaryExpression.notEqual(targetColumn, Literal.of("")));
        }
        return BinaryExpression.and(conditions);
    }

    private static Expression timestampParameter(String name, LocalDateTime value) {
        // bound as text, so no JDBC time zone conversion applies
        return new CastExpression(new Parameter(name, TIMESTAMP_FORMAT.format(value), StringType.get()),
            TimestampType.get(), false);
    }

    /**
     * Builds the inner event query.
     *
     * @param context the funnel being compiled
     * @param steps columns of the steps, in the order this query treats them
     * @param exclusions columns of the exclusions
     * @param stepFilter whether to keep only events that match a step or exclusion
     * @return the plan
     */
    static LogicalPlan build(FunnelContext context, List<StepColumns> steps, List<StepColumns> exclusions,
                             boolean stepFilter) {
        FunnelSettings settings = context.settings();
        LogicalPlan events = new TableScan(settings.eventsTable(), EventTable.ALIAS);
        if (context.breakdown() != null) {
            events = context.breakdown().joinOnto(events);
        }

        Expression where = context.scopeCondition();
        if (stepFilter) {
            List<Expression> matches = new ArrayList<>();
            for (StepColumns step : steps) {
                matches.add(step.predicate());
            }
            for (StepColumns exclusion : exclusions) {
                matches.add(exclusion.predicate());
            }
            where = BinaryExpression.and(where, BinaryExpression.or(matches));
        }

        List<Expression> columns = new ArrayList<>();
        columns.add(new AliasExpression(EventTable.timestamp(), FunnelColumns.TIMESTAMP));
        columns.add(new AliasExpression(EventTable.aggregationTarget(context.spec().aggregationTarget()),
            FunnelColumns.AGGREGATION_TARGET));
        for (StepColumns step : steps) {
            columns.addAll(step.projections());
        }
        for (StepColumns exclusion : exclusions) {
            columns.addAll(exclusion.projections());
        }
        if (context.breakdown() == null) {
            return new Project(new Filter(events, where), columns);
        }
        columns.add(context.breakdown().valueColumn());
        return context.breakdown().attribute(new Project(new Filter(events, where), columns), steps.size());
    }
}
