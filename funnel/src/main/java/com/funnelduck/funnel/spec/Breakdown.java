package com.funnelduck.funnel.spec;

import java.util.List;
import java.util.Objects;

/**
 * A breakdown dimension.
 *
 * <p>Property breakdowns use {@code propertyKeys}; one key gives a scalar value per
 * row, several keys give a list value. Cohort breakdowns use {@code cohortIds}.
 *
 * @param type the breakdown type
 * @param propertyKeys property keys (EVENT, PERSON, GROUP)
 * @param cohortIds cohort ids (COHORT); the "all users" cohort 0 is always added
 * @param limit how many distinct values keep their own partition, null for the default
 * @param groupTypeIndex group type index (GROUP)
 * @param attribution which value a target is counted under
 * @param attributionStep the step read by {@link BreakdownAttribution#STEP}, null for step 0
 */
public record Breakdown(BreakdownType type, List<String> propertyKeys, List<Long> cohortIds,
                        Integer limit, Integer groupTypeIndex,
                        BreakdownAttribution attribution, Integer attributionStep) {

    public Breakdown {
        Objects.requireNonNull(type, "type must not be null");
        propertyKeys = propertyKeys == null ? List.of() : List.copyOf(propertyKeys);
        cohortIds = cohortIds == null ? List.of() : List.copyOf(cohortIds);
        attribution = attribution == null ? BreakdownAttribution.ALL_EVENTS : attribution;
    }

    public Breakdown(BreakdownType type, List<String> propertyKeys, List<Long> cohortIds,
                     Integer limit, Integer groupTypeIndex) {
        this(type, propertyKeys, cohortIds, limit, groupTypeIndex, BreakdownAttribution.ALL_EVENTS, null);
    }

    public static Breakdown event(String... keys) {
        return new Breakdown(BreakdownType.EVENT, List.of(keys), null, null, null);
    }

    public static Breakdown person(String... keys) {
        return new Breakdown(BreakdownType.PERSON, List.of(keys), null, null, null);
    }

    public static Breakdown group(int groupTypeIndex, String... keys) {
        return new Breakdown(BreakdownType.GROUP, List.of(keys), null, null, groupTypeIndex);
    }

    public static Breakdown cohorts(Long... cohortIds) {
        return new Breakdown(BreakdownType.COHORT, null, List.of(cohortIds), null, null);
    }

    public Breakdown withLimit(Integer newLimit) {
        return new Breakdown(type, propertyKeys, cohortIds, newLimit, groupTypeIndex, attribution, attributionStep);
    }

    public Breakdown withAttribution(BreakdownAttribution newAttribution) {
        return new Breakdown(type, propertyKeys, cohortIds, limit, groupTypeIndex, newAttribution, null);
    }

    /**
     * Attributes each target to the value(s) seen on one step.
     */
    public Breakdown attributedToStep(int stepIndex) {
        return new Breakdown(type, propertyKeys, cohortIds, limit, groupTypeIndex, BreakdownAttribution.STEP, stepIndex);
    }

    /**
     * Whether the breakdown value is a list (multi-property) rather than a scalar.
     */
    public boolean isMultiProperty() {
        return type != BreakdownType.COHORT && propertyKeys.size() > 1;
    }
}
