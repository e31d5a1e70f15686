package com.funnelduck.funnel;

import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.Expression;
import com.funnelduck.funnel.actors.FunnelActorsQueryBuilder;
import com.funnelduck.funnel.breakdown.BreakdownResolver;
import com.funnelduck.funnel.breakdown.BreakdownValueSource;
import com.funnelduck.funnel.breakdown.ResolvedBreakdown;
import com.funnelduck.funnel.catalog.ActionRegistry;
import com.funnelduck.funnel.catalog.CohortMembershipService;
import com.funnelduck.funnel.engine.ExclusionEngine;
import com.funnelduck.funnel.engine.FunnelContext;
import com.funnelduck.funnel.engine.FunnelEngine;
import com.funnelduck.funnel.engine.OrderedEngine;
import com.funnelduck.funnel.engine.StepCountAggregation;
import com.funnelduck.funnel.engine.StrictEngine;
import com.funnelduck.funnel.engine.UnorderedEngine;
import com.funnelduck.funnel.result.DrillDownSelector;
import com.funnelduck.funnel.result.RowLayout;
import com.funnelduck.funnel.spec.Breakdown;
import com.funnelduck.funnel.spec.BreakdownAttribution;
import com.funnelduck.funnel.spec.ExclusionRange;
import com.funnelduck.funnel.spec.FunnelMode;
import com.funnelduck.funnel.spec.FunnelSpec;
import com.funnelduck.funnel.spec.FunnelSpecNormalizer;
import com.funnelduck.funnel.spec.TimeToConvertOptions;
import com.funnelduck.funnel.spec.VizType;
import com.funnelduck.funnel.step.StepConditionBuilder;
import com.funnelduck.generator.DuckDBSQLRenderer;
import com.funnelduck.generator.RenderedQuery;
import com.funnelduck.generator.SQLRenderer;
import com.funnelduck.logging.QueryLogger;
import com.funnelduck.logical.LogicalPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles funnel requests to DuckDB queries.
 *
 * <p>Compilation normalizes the request, resolves the breakdown (which may run the
 * ranking query through the given {@link BreakdownValueSource}), picks the engine for
 * the funnel mode and renders the plan once. Compiling is stateless; one compiler can
 * serve concurrent callers as long as each passes its own value source.
 *
 * <p>Example:
 * <pre>
 *   FunnelCompiler compiler = new FunnelCompiler(FunnelSettings.defaults(), catalog, catalog);
 *   CompiledFunnelQuery compiled = compiler.compile(spec, new QueryExecutorBreakdownSource(executor));
 * </pre>
 */
public class FunnelCompiler {

    private static final Logger logger = LoggerFactory.getLogger(FunnelCompiler.class);

    private final FunnelSettings settings;
    private final FunnelSpecNormalizer normalizer;
    private final StepConditionBuilder stepBuilder;
    private final BreakdownResolver breakdownResolver;
    private final SQLRenderer renderer;
    private final ExclusionEngine exclusionEngine = new ExclusionEngine();

    public FunnelCompiler(FunnelSettings settings, ActionRegistry actions, CohortMembershipService cohorts) {
        this(settings, actions, cohorts, new DuckDBSQLRenderer());
    }

    public FunnelCompiler(FunnelSettings settings, ActionRegistry actions, CohortMembershipService cohorts,
                          SQLRenderer renderer) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.normalizer = new FunnelSpecNormalizer(settings, actions, cohorts);
        this.stepBuilder = new StepConditionBuilder(actions);
        this.breakdownResolver = new BreakdownResolver(settings, renderer);
    }

    public FunnelSpec normalize(FunnelSpec spec) {
        return normalizer.normalize(spec);
    }

    /**
     * Compiles the step-count query of a funnel.
     *
     * @param spec the request
     * @param source runs the breakdown ranking query, if the breakdown needs one
     * @return the compiled query
     * @throws com.funnelduck.exception.FunnelConfigurationException if the request is invalid
     */
    public CompiledFunnelQuery compile(FunnelSpec spec, BreakdownValueSource source) {
        long start = System.nanoTime();
        FunnelContext context = prepare(normalize(spec), source);
        StepCountAggregation aggregation = aggregationFor(context.spec().mode());

        RenderedQuery query = renderer.render(aggregation.stepCounts(context));
        QueryLogger.logCompilation(context.spec().mode() + " funnel of " + context.stepCount() + " steps",
            elapsedMs(start));
        return new CompiledFunnelQuery(context.spec(), query, context.breakdown(),
            new RowLayout(context.stepCount(), context.hasBreakdown()));
    }

    /**
     * Compiles the per-target conversion time query of a time-to-convert funnel.
     *
     * <p>The query returns {@code aggregation_target, total_conversion_time} for every
     * target that reached the histogram's last step.
     */
    public CompiledFunnelQuery compileTimeToConvert(FunnelSpec spec) {
        long start = System.nanoTime();
        FunnelSpec normalized = normalize(spec.vizType() == VizType.TIME_TO_CONVERT
            ? spec
            : spec.toBuilder().vizType(VizType.TIME_TO_CONVERT).build());
        // breakdowns are rejected for time to convert, so no ranking query runs
        FunnelContext context = prepare(normalized, rankingQuery -> List.of());
        TimeToConvertOptions options = normalized.timeToConvert();

        LogicalPlan plan = aggregationFor(normalized.mode())
            .conversionTimes(context, options.fromStep(), options.toStep());
        RenderedQuery query = renderer.render(plan);
        QueryLogger.logCompilation("time to convert " + options.fromStep() + " -> " + options.toStep(),
            elapsedMs(start));
        return new CompiledFunnelQuery(normalized, query, null, null);
    }

    /**
     * Compiles the person list behind a drill-down selector.
     */
    public CompiledFunnelQuery compileActors(FunnelSpec spec, DrillDownSelector selector, BreakdownValueSource source) {
        long start = System.nanoTime();
        FunnelContext context = prepare(normalize(spec), source);
        FunnelActorsQueryBuilder actors = new FunnelActorsQueryBuilder(aggregationFor(context.spec().mode()));

        RenderedQuery query = renderer.render(actors.build(context, selector));
        QueryLogger.logCompilation("actors of step " + selector.funnelStep(), elapsedMs(start));
        return new CompiledFunnelQuery(context.spec(), query, context.breakdown(), null);
    }

    /**
     * Resolves the breakdown and the applicable exclusions of a normalized spec.
     */
    FunnelContext prepare(FunnelSpec normalized, BreakdownValueSource source) {
        ResolvedBreakdown breakdown = null;
        if (normalized.breakdown().isPresent()) {
            breakdown = breakdownResolver.resolve(normalized.breakdown().get(), rankingCondition(normalized), source);
        }

        List<ExclusionRange> exclusions = normalized.exclusions();
        if (normalized.mode() == FunnelMode.STRICT && !exclusions.isEmpty()) {
            logger.warn("Strict funnels do not support exclusions, ignoring {} exclusion(s)", exclusions.size());
            exclusions = List.of();
        }
        return new FunnelContext(normalized, settings, stepBuilder, breakdown, exclusions);
    }

    /**
     * Events that rank breakdown values: those in scope matching the first step, the
     * attributed step, or any step for touch attribution and unordered funnels.
     */
    private Expression rankingCondition(FunnelSpec spec) {
        BreakdownAttribution attribution = spec.breakdown().map(Breakdown::attribution)
            .orElse(BreakdownAttribution.ALL_EVENTS);
        int from = 0;
        int to = 1;
        if (spec.mode() == FunnelMode.UNORDERED
            || attribution == BreakdownAttribution.FIRST_TOUCH
            || attribution == BreakdownAttribution.LAST_TOUCH) {
            to = spec.stepCount();
        } else if (attribution == BreakdownAttribution.STEP) {
            from = spec.breakdown().get().attributionStep();
            to = from + 1;
        }
        List<Expression> steps = new ArrayList<>();
        for (int i = from; i < to; i++) {
            steps.add(stepBuilder.predicate(spec.steps().get(i), "breakdown_step_" + i + "_"));
        }
        return BinaryExpression.and(FunnelContext.eventScope(spec), BinaryExpression.or(steps));
    }

    StepCountAggregation aggregationFor(FunnelMode mode) {
        FunnelEngine engine = switch (mode) {
            case ORDERED -> new OrderedEngine(exclusionEngine);
            case STRICT -> new StrictEngine(exclusionEngine);
            case UNORDERED -> new UnorderedEngine(exclusionEngine);
        };
        return new StepCountAggregation(engine, exclusionEngine);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
