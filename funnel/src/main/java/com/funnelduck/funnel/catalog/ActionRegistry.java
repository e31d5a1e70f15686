package com.funnelduck.funnel.catalog;

import java.util.Optional;

/**
 * Resolves action references used by funnel steps and exclusions.
 */
public interface ActionRegistry {

    Optional<ActionDefinition> findAction(long actionId);
}
