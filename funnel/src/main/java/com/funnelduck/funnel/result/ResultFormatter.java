package com.funnelduck.funnel.result;

import com.funnelduck.funnel.breakdown.ResolvedBreakdown;
import com.funnelduck.funnel.catalog.ActionDefinition;
import com.funnelduck.funnel.catalog.ActionRegistry;
import com.funnelduck.funnel.catalog.CohortMembershipService;
import com.funnelduck.funnel.spec.ActionStep;
import com.funnelduck.funnel.spec.FunnelSpec;
import com.funnelduck.funnel.spec.StepDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns funnel rows into {@link FunnelResult}s.
 *
 * <p>Each row counts targets by the exact number of steps they reached. Walking the
 * steps in reverse and accumulating gives the number of targets that reached at least
 * each step, which is never larger than the count of the step before.
 */
public class ResultFormatter {

    private static final Logger logger = LoggerFactory.getLogger(ResultFormatter.class);

    private final ActionRegistry actions;
    private final CohortMembershipService cohorts;

    public ResultFormatter(ActionRegistry actions, CohortMembershipService cohorts) {
        this.actions = Objects.requireNonNull(actions, "actions must not be null");
        this.cohorts = Objects.requireNonNull(cohorts, "cohorts must not be null");
    }

    /**
     * Formats the rows of a compiled funnel.
     *
     * @param spec the normalized spec
     * @param breakdown the resolved breakdown, or null
     * @param layout the row layout the query was compiled with
     * @param rows the query rows
     * @return the result, one partition per row
     */
    public FunnelResult format(FunnelSpec spec, ResolvedBreakdown breakdown, RowLayout layout, List<List<Object>> rows) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(layout, "layout must not be null");
        Objects.requireNonNull(rows, "rows must not be null");

        List<FunnelWarning> warnings = new ArrayList<>();
        List<List<StepResult>> partitions = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != layout.width()) {
                throw new IllegalArgumentException("expected " + layout.width() + " columns, got " + row.size());
            }
            partitions.add(partition(spec, breakdown, layout, row));
        }

        if (breakdown == null && partitions.isEmpty()) {
            partitions.add(partition(spec, null, layout, zeroRow(layout)));
        }
        if (breakdown != null && partitions.isEmpty()) {
            logger.info("Breakdown matched no values");
            warnings.add(FunnelWarning.EMPTY_BREAKDOWN);
        }
        boolean anyReached = partitions.stream().anyMatch(steps -> steps.get(0).matchedCount() > 0);
        if (!anyReached) {
            logger.info("No target reached the first step");
            warnings.add(FunnelWarning.ZERO_STEPS_REACHED);
        }
        return new FunnelResult(partitions, warnings);
    }

    private List<StepResult> partition(FunnelSpec spec, ResolvedBreakdown breakdown, RowLayout layout, List<Object> row) {
        int stepCount = layout.stepCount();
        Object breakdownValue = breakdown == null ? null : row.get(layout.propIndex());
        String breakdownLabel = breakdown == null ? null : breakdownLabel(breakdown, breakdownValue);

        StepResult[] steps = new StepResult[stepCount];
        long reached = 0;
        for (int i = stepCount - 1; i >= 0; i--) {
            reached += asLong(row.get(layout.countIndex(i + 1)));
            StepDefinition step = spec.steps().get(i);
            steps[i] = new StepResult(
                i,
                label(step),
                step.kind(),
                step instanceof ActionStep action ? action.actionId() : null,
                step.customName().orElse(null),
                reached,
                i == 0 ? null : asDouble(row.get(layout.averageIndex(i))),
                i == 0 ? null : asDouble(row.get(layout.medianIndex(i))),
                breakdownLabel,
                breakdownValue,
                DrillDownSelector.converted(i, breakdownValue),
                i == 0 ? null : DrillDownSelector.dropped(i, breakdownValue));
        }
        return Arrays.asList(steps);
    }

    private String label(StepDefinition step) {
        if (step instanceof ActionStep action && action.customName().isEmpty()) {
            return actions.findAction(action.actionId()).map(ActionDefinition::name).orElse(step.label());
        }
        return step.label();
    }

    String breakdownLabel(ResolvedBreakdown breakdown, Object value) {
        if (breakdown.isCohort()) {
            return cohorts.cohortName(asLong(value));
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return String.valueOf(value);
    }

    private static List<Object> zeroRow(RowLayout layout) {
        List<Object> row = new ArrayList<>(layout.width());
        for (int n = 1; n <= layout.stepCount(); n++) {
            row.add(0L);
        }
        while (row.size() < layout.width()) {
            row.add(null);
        }
        return row;
    }

    private static long asLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }

    private static Double asDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.valueOf(value.toString());
    }
}
