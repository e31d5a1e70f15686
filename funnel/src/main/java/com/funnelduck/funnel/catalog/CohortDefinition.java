package com.funnelduck.funnel.catalog;

import java.util.Objects;

/**
 * A cohort known to the membership service.
 *
 * @param id the cohort id
 * @param name the display name
 */
public record CohortDefinition(long id, String name) {

    /** Synthetic cohort containing every person that performed an event. */
    public static final long ALL_USERS_ID = 0L;
    public static final CohortDefinition ALL_USERS = new CohortDefinition(ALL_USERS_ID, "All Users");

    public CohortDefinition {
        Objects.requireNonNull(name, "name must not be null");
    }
}
