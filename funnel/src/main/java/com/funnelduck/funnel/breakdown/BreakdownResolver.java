package com.funnelduck.funnel.breakdown;

import com.funnelduck.exception.FunnelConfigurationException;
import com.funnelduck.expression.AliasExpression;
import com.funnelduck.expression.ArrayLiteralExpression;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.ColumnReference;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.FunctionCall;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.StarExpression;
import com.funnelduck.funnel.FunnelSettings;
import com.funnelduck.funnel.catalog.CohortDefinition;
import com.funnelduck.funnel.spec.Breakdown;
import com.funnelduck.funnel.spec.BreakdownType;
import com.funnelduck.funnel.spec.PropertyType;
import com.funnelduck.funnel.step.EventTable;
import com.funnelduck.generator.SQLRenderer;
import com.funnelduck.logical.Aggregate;
import com.funnelduck.logical.AliasedRelation;
import com.funnelduck.logical.Filter;
import com.funnelduck.logical.Limit;
import com.funnelduck.logical.LogicalPlan;
import com.funnelduck.logical.Sort;
import com.funnelduck.logical.TableScan;
import com.funnelduck.logical.Union;
import com.funnelduck.types.LongType;
import com.funnelduck.types.StringType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves a breakdown into the {@code prop} column of the funnel query.
 *
 * <p>Property breakdowns (event, person, group) read the property from the event row,
 * with NULL coalesced to {@code ''} so that missing values form their own partition.
 * Several property keys produce a list value. A ranking query counts matching events
 * per value; when more values exist than the limit allows, everything past the top
 * {@code limit} folds into {@code 'Other'} ({@code ['Other']} for list values).
 * Ties in the ranking break by value, ascending.
 *
 * <p>Cohort breakdowns join each event's {@code distinct_id} against the requested
 * cohorts' membership and the synthetic "all users" cohort (id 0). An event belongs
 * to every cohort its person is in, and cohorts never fold into "Other".
 */
public class BreakdownResolver {

    private static final Logger logger = LoggerFactory.getLogger(BreakdownResolver.class);

    static final String COHORT_JOIN_ALIAS = "cohort_join";
    static final String COHORT_DISTINCT_ID = "cohort_distinct_id";
    static final String COHORT_VALUE = "value";

    private final FunnelSettings settings;
    private final SQLRenderer renderer;

    public BreakdownResolver(FunnelSettings settings, SQLRenderer renderer) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Resolves a normalized breakdown.
     *
     * @param breakdown the breakdown, with its limit set
     * @param eventCondition which events rank the breakdown values (scope and step entities)
     * @param source runs the ranking query
     * @return the resolved breakdown
     */
    public ResolvedBreakdown resolve(Breakdown breakdown, Expression eventCondition, BreakdownValueSource source) {
        Objects.requireNonNull(breakdown, "breakdown must not be null");
        if (breakdown.type() == BreakdownType.COHORT) {
            return resolveCohorts(breakdown);
        }

        int limit = requireLimit(breakdown);
        List<Object> ranked = source.fetchValues(renderer.render(rankingPlan(breakdown, eventCondition)));
        Expression raw = rawValue(breakdown);

        if (ranked.size() <= limit) {
            logger.debug("Breakdown {} has {} values, no folding", breakdown.propertyKeys(), ranked.size());
            return new ResolvedBreakdown(breakdown, buckets(ranked), raw, null, null, emptyValue(breakdown), null, null);
        }

        List<Object> kept = ranked.subList(0, limit);
        List<BreakdownBucket> buckets = buckets(kept);
        buckets.add(BreakdownBucket.other(limit, breakdown.isMultiProperty()));

        List<Expression> keptValues = new ArrayList<>(kept.size());
        for (Object value : kept) {
            keptValues.add(valueLiteral(value, breakdown));
        }
        Expression other = valueLiteral(breakdown.isMultiProperty() ? List.of(BreakdownBucket.OTHER) : BreakdownBucket.OTHER,
            breakdown);

        logger.info("Breakdown {} kept top {} values, folding the rest into '{}'",
            breakdown.propertyKeys(), limit, BreakdownBucket.OTHER);
        return new ResolvedBreakdown(breakdown, buckets, raw, keptValues, other, emptyValue(breakdown), null, null);
    }

    /**
     * The ranking query: matching events counted per breakdown value.
     *
     * <pre>
     *   SELECT &lt;value&gt; AS value, count(*) AS count FROM events AS e WHERE ...
     *   GROUP BY value ORDER BY count DESC, value ASC LIMIT limit + 1
     * </pre>
     */
    public LogicalPlan rankingPlan(Breakdown breakdown, Expression eventCondition) {
        int limit = requireLimit(breakdown);
        LogicalPlan events = new TableScan(settings.eventsTable(), EventTable.ALIAS);
        if (eventCondition != null) {
            events = new Filter(events, eventCondition);
        }

        Expression raw = rawValue(breakdown);
        Aggregate counted = new Aggregate(events,
            List.of(new AliasExpression(raw, "value")),
            List.of(new AliasExpression(FunctionCall.of("count", LongType.get(), StarExpression.get()), "count")));
        Sort ranked = new Sort(counted, List.of(
            Sort.SortOrder.desc(ColumnReference.of("count", LongType.get())),
            Sort.SortOrder.asc(ColumnReference.of("value", raw.dataType()))));
        return new Limit(ranked, limit + 1L);
    }

    /**
     * The unfolded breakdown value of the scanned event row.
     */
    public Expression rawValue(Breakdown breakdown) {
        if (breakdown.type() == BreakdownType.COHORT) {
            return ColumnReference.qualified(COHORT_JOIN_ALIAS, COHORT_VALUE, LongType.get());
        }
        if (breakdown.propertyKeys().isEmpty()) {
            throw new FunnelConfigurationException("breakdown.propertyKeys", "no property key to break down by");
        }

        PropertyType source = switch (breakdown.type()) {
            case PERSON -> PropertyType.PERSON;
            case GROUP -> PropertyType.GROUP;
            default -> PropertyType.EVENT;
        };
        List<Expression> values = new ArrayList<>(breakdown.propertyKeys().size());
        for (String key : breakdown.propertyKeys()) {
            values.add(FunctionCall.of("coalesce", StringType.get(),
                EventTable.property(source, breakdown.groupTypeIndex(), key), Literal.of("")));
        }
        return breakdown.isMultiProperty() ? new ArrayLiteralExpression(values) : values.get(0);
    }

    private ResolvedBreakdown resolveCohorts(Breakdown breakdown) {
        List<BreakdownBucket> buckets = new ArrayList<>();
        List<LogicalPlan> memberships = new ArrayList<>();

        for (Long cohortId : breakdown.cohortIds()) {
            buckets.add(new BreakdownBucket(cohortId, buckets.size()));
            LogicalPlan members = new Filter(new TableScan(settings.cohortsTable()),
                BinaryExpression.equal(ColumnReference.of("cohort_id", LongType.get()), Literal.of(cohortId.longValue())));
            memberships.add(membership(members, cohortId));
        }
        buckets.add(new BreakdownBucket(CohortDefinition.ALL_USERS_ID, buckets.size()));
        memberships.add(membership(new TableScan(settings.eventsTable()), CohortDefinition.ALL_USERS_ID));

        LogicalPlan union = memberships.size() == 1 ? memberships.get(0) : new Union(memberships, true);
        Expression condition = BinaryExpression.equal(EventTable.distinctId(),
            ColumnReference.qualified(COHORT_JOIN_ALIAS, COHORT_DISTINCT_ID, StringType.get()));

        logger.debug("Cohort breakdown over {} cohorts", buckets.size());
        return new ResolvedBreakdown(breakdown, buckets, rawValue(breakdown), null, null, null,
            new AliasedRelation(union, COHORT_JOIN_ALIAS), condition);
    }

    /**
     * {@code SELECT distinct_id AS cohort_distinct_id, <id> AS value FROM source GROUP BY cohort_distinct_id}
     */
    private static LogicalPlan membership(LogicalPlan source, long cohortId) {
        return new Aggregate(source,
            List.of(new AliasExpression(ColumnReference.of(EventTable.DISTINCT_ID, StringType.get()), COHORT_DISTINCT_ID)),
            List.of(new AliasExpression(Literal.of(cohortId), COHORT_VALUE)));
    }

    /**
     * The value of an event row that lacks every breakdown property.
     */
    private static Expression emptyValue(Breakdown breakdown) {
        if (!breakdown.isMultiProperty()) {
            return Literal.of("");
        }
        List<Expression> empties = new ArrayList<>(breakdown.propertyKeys().size());
        for (int i = 0; i < breakdown.propertyKeys().size(); i++) {
            empties.add(Literal.of(""));
        }
        return new ArrayLiteralExpression(empties);
    }

    private static List<BreakdownBucket> buckets(List<Object> values) {
        List<BreakdownBucket> buckets = new ArrayList<>(values.size() + 1);
        for (Object value : values) {
            buckets.add(new BreakdownBucket(value, buckets.size()));
        }
        return buckets;
    }

    private static Expression valueLiteral(Object value, Breakdown breakdown) {
        if (breakdown.isMultiProperty()) {
            if (!(value instanceof List<?> list)) {
                throw new IllegalStateException("expected a list breakdown value, got " + value);
            }
            List<Expression> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                elements.add(Literal.of(String.valueOf(element)));
            }
            return new ArrayLiteralExpression(elements);
        }
        return Literal.of(String.valueOf(value));
    }

    private static int requireLimit(Breakdown breakdown) {
        if (breakdown.limit() == null) {
            throw new IllegalStateException("breakdown limit is unset; normalize the request first");
        }
        return breakdown.limit();
    }
}
