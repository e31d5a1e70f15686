package com.funnelduck.funnel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defaults and table names used by the funnel compiler.
 *
 * <p>Values come from system properties and fall back to defaults when a
 * property is absent or malformed:
 * <ul>
 *   <li>{@code funnelduck.events.table}: event table, default {@code events}</li>
 *   <li>{@code funnelduck.cohorts.table}: cohort membership table, default {@code cohort_people}</li>
 *   <li>{@code funnelduck.breakdown.limit}: breakdown values kept before "Other", default 25</li>
 *   <li>{@code funnelduck.window.days}: conversion window in days, default 14</li>
 * </ul>
 *
 * @param eventsTable the event table
 * @param cohortsTable the cohort membership table
 * @param breakdownLimit default breakdown limit
 * @param windowDays default conversion window, in days
 */
public record FunnelSettings(String eventsTable, String cohortsTable, int breakdownLimit, int windowDays) {

    private static final Logger logger = LoggerFactory.getLogger(FunnelSettings.class);

    public static final String PROP_EVENTS_TABLE = "funnelduck.events.table";
    public static final String PROP_COHORTS_TABLE = "funnelduck.cohorts.table";
    public static final String PROP_BREAKDOWN_LIMIT = "funnelduck.breakdown.limit";
    public static final String PROP_WINDOW_DAYS = "funnelduck.window.days";

    public static final String DEFAULT_EVENTS_TABLE = "events";
    public static final String DEFAULT_COHORTS_TABLE = "cohort_people";
    public static final int DEFAULT_BREAKDOWN_LIMIT = 25;
    public static final int DEFAULT_WINDOW_DAYS = 14;

    public FunnelSettings {
        if (eventsTable == null || eventsTable.isBlank()) {
            throw new IllegalArgumentException("eventsTable must not be blank");
        }
        if (cohortsTable == null || cohortsTable.isBlank()) {
            throw new IllegalArgumentException("cohortsTable must not be blank");
        }
        if (breakdownLimit < 1) {
            throw new IllegalArgumentException("breakdownLimit must be positive: " + breakdownLimit);
        }
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be positive: " + windowDays);
        }
    }

    public static FunnelSettings defaults() {
        return new FunnelSettings(DEFAULT_EVENTS_TABLE, DEFAULT_COHORTS_TABLE,
            DEFAULT_BREAKDOWN_LIMIT, DEFAULT_WINDOW_DAYS);
    }

    /**
     * Reads settings from system properties.
     *
     * @return the configured settings
     */
    public static FunnelSettings fromSystemProperties() {
        return new FunnelSettings(
            getConfiguredString(PROP_EVENTS_TABLE, DEFAULT_EVENTS_TABLE),
            getConfiguredString(PROP_COHORTS_TABLE, DEFAULT_COHORTS_TABLE),
            getConfiguredPositiveInt(PROP_BREAKDOWN_LIMIT, DEFAULT_BREAKDOWN_LIMIT),
            getConfiguredPositiveInt(PROP_WINDOW_DAYS, DEFAULT_WINDOW_DAYS));
    }

    // ========== Configuration Helpers ==========

    private static String getConfiguredString(String property, String defaultValue) {
        String value = System.getProperty(property);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return defaultValue;
    }

    private static int getConfiguredPositiveInt(String property, int defaultValue) {
        String value = System.getProperty(property);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warn("Ignoring non-positive {}={}, using {}", property, value, defaultValue);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed {}={}, using {}", property, value, defaultValue);
            }
        }
        return defaultValue;
    }
}
