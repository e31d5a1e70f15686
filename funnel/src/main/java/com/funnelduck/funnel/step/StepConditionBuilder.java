package com.funnelduck.funnel.step;

import com.funnelduck.exception.FunnelConfigurationException;
import com.funnelduck.expression.BinaryExpression;
import com.funnelduck.expression.Expression;
import com.funnelduck.expression.Literal;
import com.funnelduck.expression.Parameter;
import com.funnelduck.funnel.catalog.ActionDefinition;
import com.funnelduck.funnel.catalog.ActionRegistry;
import com.funnelduck.funnel.spec.ActionStep;
import com.funnelduck.funnel.spec.EventStep;
import com.funnelduck.funnel.spec.ExclusionRange;
import com.funnelduck.funnel.spec.StepDefinition;
import com.funnelduck.types.StringType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles steps into event predicates and per-step columns.
 *
 * <p>An event step matches on {@code e.event = ?}, or every event when it has no
 * event name. An action step ORs its matchers, each an event name plus the
 * matcher's own property filters. The step's property filters are ANDed on top
 * in both cases.
 */
public class StepConditionBuilder {

    private final ActionRegistry actions;
    private final PropertyFilterCompiler filterCompiler;

    public StepConditionBuilder(ActionRegistry actions) {
        this(actions, new PropertyFilterCompiler());
    }

    public StepConditionBuilder(ActionRegistry actions, PropertyFilterCompiler filterCompiler) {
        this.actions = Objects.requireNonNull(actions, "actions must not be null");
        this.filterCompiler = Objects.requireNonNull(filterCompiler, "filterCompiler must not be null");
    }

    /**
     * Builds the predicate matching one step.
     *
     * @param step the step
     * @param paramPrefix prefix for the names of the parameters it binds, e.g. {@code "step_0_"}
     * @return the predicate
     * @throws FunnelConfigurationException if an action cannot be resolved
     */
    public Expression predicate(StepDefinition step, String paramPrefix) {
        Expression entity;
        if (step instanceof EventStep event) {
            entity = event.matchesAnyEvent()
                ? Literal.of(true)
                : BinaryExpression.equal(EventTable.event(),
                    new Parameter(paramPrefix + "event", event.eventName(), StringType.get()));
        } else if (step instanceof ActionStep action) {
            entity = actionPredicate(action, paramPrefix);
        } else {
            throw new IllegalStateException("Unknown step type: " + step.getClass().getName());
        }

        Expression filters = filterCompiler.compileAll(step.propertyFilters(), paramPrefix);
        return filters == null ? entity : BinaryExpression.and(entity, filters);
    }

    private Expression actionPredicate(ActionStep step, String paramPrefix) {
        ActionDefinition action = actions.findAction(step.actionId())
            .orElseThrow(() -> new FunnelConfigurationException("steps",
                "action " + step.actionId() + " does not exist"));
        if (action.matchers().isEmpty()) {
            throw new FunnelConfigurationException("steps", "action " + step.actionId() + " has no matchers");
        }

        List<Expression> alternatives = new ArrayList<>(action.matchers().size());
        for (int m = 0; m < action.matchers().size(); m++) {
            ActionDefinition.Matcher matcher = action.matchers().get(m);
            String matcherPrefix = paramPrefix + "action_" + m + "_";
            Expression match = matcher.eventName() == null
                ? Literal.of(true)
                : BinaryExpression.equal(EventTable.event(),
                    new Parameter(matcherPrefix + "event", matcher.eventName(), StringType.get()));
            Expression filters = filterCompiler.compileAll(matcher.propertyFilters(), matcherPrefix);
            alternatives.add(filters == null ? match : BinaryExpression.and(match, filters));
        }
        return BinaryExpression.or(alternatives);
    }

    public StepColumns stepColumns(StepDefinition step, int index, List<RecordingField> recordingFields) {
        return new StepColumns(index, "", predicate(step, FunnelColumns.step(index) + "_"), recordingFields);
    }

    /**
     * Columns of exclusion {@code k}, indexed by the step its range starts at.
     */
    public StepColumns exclusionColumns(ExclusionRange exclusion, int exclusionIndex) {
        String prefix = FunnelColumns.exclusionPrefix(exclusionIndex);
        return new StepColumns(exclusion.fromStep(), prefix,
            predicate(exclusion.entity(), prefix + "step_" + exclusion.fromStep() + "_"), List.of());
    }
}
