package com.funnelduck.funnel;

import com.funnelduck.exception.QueryExecutionException;
import com.funnelduck.funnel.actors.FunnelActor;
import com.funnelduck.funnel.breakdown.BreakdownValueSource;
import com.funnelduck.funnel.breakdown.QueryExecutorBreakdownSource;
import com.funnelduck.funnel.catalog.ActionRegistry;
import com.funnelduck.funnel.catalog.CohortMembershipService;
import com.funnelduck.funnel.histogram.ConversionTimeHistogram;
import com.funnelduck.funnel.histogram.TimeToConvertHistogramBuilder;
import com.funnelduck.funnel.result.DrillDownSelector;
import com.funnelduck.funnel.result.FunnelResult;
import com.funnelduck.funnel.result.ResultFormatter;
import com.funnelduck.funnel.spec.FunnelSpec;
import com.funnelduck.funnel.step.FunnelColumns;
import com.funnelduck.funnel.step.RecordingField;
import com.funnelduck.logging.QueryLogger;
import com.funnelduck.runtime.QueryExecutor;
import com.funnelduck.runtime.QueryResult;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Compiles funnels and runs them against DuckDB.
 *
 * <p>All queries of one call (breakdown ranking and the funnel query) share a query id in
 * the logging context.
 */
public class FunnelQueryRunner {

    private final FunnelCompiler compiler;
    private final QueryExecutor executor;
    private final ResultFormatter formatter;
    private final TimeToConvertHistogramBuilder histogramBuilder = new TimeToConvertHistogramBuilder();

    public FunnelQueryRunner(FunnelSettings settings, ActionRegistry actions, CohortMembershipService cohorts,
                             QueryExecutor executor) {
        this(new FunnelCompiler(settings, actions, cohorts), executor, new ResultFormatter(actions, cohorts));
    }

    public FunnelQueryRunner(FunnelCompiler compiler, QueryExecutor executor, ResultFormatter formatter) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    /**
     * Runs a funnel and formats its step counts.
     *
     * @throws com.funnelduck.exception.FunnelConfigurationException if the request is invalid
     * @throws QueryExecutionException if DuckDB fails
     */
    public FunnelResult run(FunnelSpec spec) {
        return inQueryContext(() -> {
            CompiledFunnelQuery compiled = compiler.compile(spec, valueSource());
            QueryResult result = executor.execute(compiled.query());
            return formatter.format(compiled.spec(), compiled.breakdown(), compiled.layout(), result.rows());
        });
    }

    /**
     * Runs a time-to-convert funnel and bins the per-target conversion times.
     */
    public ConversionTimeHistogram runTimeToConvert(FunnelSpec spec) {
        return inQueryContext(() -> {
            CompiledFunnelQuery compiled = compiler.compileTimeToConvert(spec);
            QueryResult result = executor.execute(compiled.query());
            int column = result.columnIndex(FunnelColumns.TOTAL_CONVERSION_TIME);
            List<Double> samples = new ArrayList<>(result.rowCount());
            for (List<Object> row : result.rows()) {
                Object value = row.get(column);
                if (value instanceof Number number) {
                    samples.add(number.doubleValue());
                }
            }
            return histogramBuilder.build(samples, compiled.spec().timeToConvert().binCount());
        });
    }

    /**
     * Lists the targets behind a drill-down selector, ordered by target.
     */
    public List<FunnelActor> actors(FunnelSpec spec, DrillDownSelector selector) {
        return inQueryContext(() -> {
            CompiledFunnelQuery compiled = compiler.compileActors(spec, selector, valueSource());
            QueryResult result = executor.execute(compiled.query());
            return toActors(compiled, result);
        });
    }

    private List<FunnelActor> toActors(CompiledFunnelQuery compiled, QueryResult result) {
        int stepCount = compiled.spec().stepCount();
        List<RecordingField> fields = compiled.spec().includeRecordings()
            ? List.of(RecordingField.values())
            : List.of();
        int targetColumn = result.columnIndex(FunnelColumns.AGGREGATION_TARGET);
        int stepsColumn = result.columnIndex(FunnelColumns.STEPS);
        int propColumn = compiled.breakdown() == null ? -1 : result.columnIndex(FunnelColumns.PROP);

        List<FunnelActor> actors = new ArrayList<>(result.rowCount());
        for (List<Object> row : result.rows()) {
            Map<RecordingField, List<List<String>>> recordings = new EnumMap<>(RecordingField.class);
            for (RecordingField field : fields) {
                List<List<String>> perStep = new ArrayList<>(stepCount);
                for (int i = 0; i < stepCount; i++) {
                    perStep.add(strings(row.get(result.columnIndex(FunnelColumns.matched(field, i)))));
                }
                recordings.put(field, perStep);
            }
            actors.add(new FunnelActor(
                String.valueOf(row.get(targetColumn)),
                ((Number) row.get(stepsColumn)).intValue(),
                propColumn < 0 ? null : row.get(propColumn),
                recordings));
        }
        return actors;
    }

    private static List<String> strings(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> strings = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element != null) {
                strings.add(element.toString());
            }
        }
        return strings;
    }

    private BreakdownValueSource valueSource() {
        return new QueryExecutorBreakdownSource(executor);
    }

    private static <T> T inQueryContext(Supplier<T> work) {
        boolean ownsContext = QueryLogger.startQuery(QueryLogger.newQueryId());
        try {
            return work.get();
        } catch (RuntimeException e) {
            QueryLogger.logError(e);
            throw e;
        } finally {
            if (ownsContext) {
                QueryLogger.clearContext();
            }
        }
    }
}
