package com.funnelduck.funnel.spec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A step matching events by name.
 *
 * @param eventName the event name, or null to match any event
 * @param propertyFilters filters on the event row
 * @param customNameValue an optional display name
 */
public record EventStep(String eventName, List<PropertyFilter> propertyFilters, String customNameValue)
        implements StepDefinition {

    public EventStep {
        propertyFilters = List.copyOf(Objects.requireNonNull(propertyFilters, "propertyFilters must not be null"));
    }

    public static EventStep of(String eventName, PropertyFilter... filters) {
        return new EventStep(eventName, List.of(filters), null);
    }

    public static EventStep anyEvent(PropertyFilter... filters) {
        return new EventStep(null, List.of(filters), null);
    }

    public EventStep withCustomName(String name) {
        return new EventStep(eventName, propertyFilters, name);
    }

    public boolean matchesAnyEvent() {
        return eventName == null;
    }

    @Override
    public StepKind kind() {
        return StepKind.EVENT;
    }

    @Override
    public Optional<String> customName() {
        return Optional.ofNullable(customNameValue);
    }

    @Override
    public String label() {
        if (customNameValue != null) {
            return customNameValue;
        }
        return eventName == null ? "All events" : eventName;
    }

    @Override
    public boolean sameEntityAs(StepDefinition other) {
        return other instanceof EventStep event && Objects.equals(eventName, event.eventName);
    }
}
