package com.funnelduck.funnel.catalog;

import com.funnelduck.funnel.spec.PropertyFilter;
import java.util.List;
import java.util.Objects;

/**
 * A saved action: a named set of alternative event matches.
 *
 * @param id the action id
 * @param name the display name
 * @param matchers the alternatives; an event matching any of them matches the action
 */
public record ActionDefinition(long id, String name, List<Matcher> matchers) {

    public ActionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        matchers = List.copyOf(Objects.requireNonNull(matchers, "matchers must not be null"));
    }

    /**
     * One alternative of an action.
     *
     * @param eventName the event name, or null for any event
     * @param propertyFilters filters that must all hold
     */
    public record Matcher(String eventName, List<PropertyFilter> propertyFilters) {

        public Matcher {
            propertyFilters = List.copyOf(Objects.requireNonNull(propertyFilters, "propertyFilters must not be null"));
        }

        public static Matcher event(String eventName, PropertyFilter... filters) {
            return new Matcher(eventName, List.of(filters));
        }
    }
}
