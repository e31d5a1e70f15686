package com.funnelduck.funnel.catalog;

import java.util.Optional;

/**
 * Resolves cohorts for cohort breakdowns.
 *
 * <p>Membership itself lives in the cohort table ({@code cohort_id, distinct_id}) next to
 * the events, so that the funnel query can join it; this service only answers
 * which cohorts exist and what they are called.
 */
public interface CohortMembershipService {

    Optional<CohortDefinition> findCohort(long cohortId);

    /**
     * Returns the display name of a cohort id, falling back to the id itself.
     */
    default String cohortName(long cohortId) {
        if (cohortId == CohortDefinition.ALL_USERS_ID) {
            return CohortDefinition.ALL_USERS.name();
        }
        return findCohort(cohortId).map(CohortDefinition::name).orElse(Long.toString(cohortId));
    }
}
