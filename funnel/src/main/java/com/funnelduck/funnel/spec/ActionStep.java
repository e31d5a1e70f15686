package com.funnelduck.funnel.spec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A step matching any of the sub-steps of a saved action.
 *
 * @param actionId the action id, resolved through {@link com.funnelduck.funnel.catalog.ActionRegistry}
 * @param propertyFilters filters ANDed on top of the action match
 * @param customNameValue an optional display name
 */
public record ActionStep(long actionId, List<PropertyFilter> propertyFilters, String customNameValue)
        implements StepDefinition {

    public ActionStep {
        propertyFilters = List.copyOf(Objects.requireNonNull(propertyFilters, "propertyFilters must not be null"));
    }

    public static ActionStep of(long actionId, PropertyFilter... filters) {
        return new ActionStep(actionId, List.of(filters), null);
    }

    public ActionStep withCustomName(String name) {
        return new ActionStep(actionId, propertyFilters, name);
    }

    @Override
    public StepKind kind() {
        return StepKind.ACTION;
    }

    @Override
    public Optional<String> customName() {
        return Optional.ofNullable(customNameValue);
    }

    @Override
    public String label() {
        return customNameValue != null ? customNameValue : "action " + actionId;
    }

    @Override
    public boolean sameEntityAs(StepDefinition other) {
        return other instanceof ActionStep action && action.actionId == actionId;
    }
}
