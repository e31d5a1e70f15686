package com.funnelduck.funnel.spec;

/**
 * Ordering semantics of a funnel.
 */
public enum FunnelMode {
    /** Steps must happen in order, other events may happen in between. */
    ORDERED,
    /** Steps must happen in order with no other event of the person in between. */
    STRICT,
    /** Steps may happen in any order. */
    UNORDERED
}
