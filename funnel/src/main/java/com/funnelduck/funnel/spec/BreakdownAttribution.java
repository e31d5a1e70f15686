package com.funnelduck.funnel.spec;

/**
 * Which breakdown value an aggregation target is counted under.
 */
public enum BreakdownAttribution {
    /** The value of the target's earliest step event that carries one. */
    FIRST_TOUCH,
    /** The value of the target's latest step event that carries one. */
    LAST_TOUCH,
    /** Every event keeps its own value, so a target only converts within one value. */
    ALL_EVENTS,
    /** The values seen on one chosen step; the target may count under each of them. */
    STEP
}
