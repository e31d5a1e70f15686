package com.funnelduck.funnel.breakdown;

import java.util.List;

/**
 * One breakdown partition.
 *
 * @param value the breakdown value: a String, a List of Strings for multi-property
 *              breakdowns, or a cohort id
 * @param ordinalRank 0-based rank by popularity; the "Other" bucket ranks last
 */
public record BreakdownBucket(Object value, int ordinalRank) {

    public static final String OTHER = "Other";

    public static BreakdownBucket other(int ordinalRank, boolean listValued) {
        return new BreakdownBucket(listValued ? List.of(OTHER) : OTHER, ordinalRank);
    }

    public boolean isOther() {
        return OTHER.equals(value) || List.of(OTHER).equals(value);
    }
}
