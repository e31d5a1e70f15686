package com.funnelduck.funnel.catalog;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed action registry and cohort service, for embedding and tests.
 */
public class InMemoryCatalog implements ActionRegistry, CohortMembershipService {

    private final Map<Long, ActionDefinition> actions = new ConcurrentHashMap<>();
    private final Map<Long, CohortDefinition> cohorts = new ConcurrentHashMap<>();

    public InMemoryCatalog addAction(ActionDefinition action) {
        actions.put(action.id(), action);
        return this;
    }

    public InMemoryCatalog addCohort(CohortDefinition cohort) {
        if (cohort.id() == CohortDefinition.ALL_USERS_ID) {
            throw new IllegalArgumentException("cohort id 0 is reserved for all users");
        }
        cohorts.put(cohort.id(), cohort);
        return this;
    }

    @Override
    public Optional<ActionDefinition> findAction(long actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    @Override
    public Optional<CohortDefinition> findCohort(long cohortId) {
        if (cohortId == CohortDefinition.ALL_USERS_ID) {
            return Optional.of(CohortDefinition.ALL_USERS);
        }
        return Optional.ofNullable(cohorts.get(cohortId));
    }
}
