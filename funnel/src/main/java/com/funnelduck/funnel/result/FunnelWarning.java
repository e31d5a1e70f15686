package com.funnelduck.funnel.result;

/**
 * Non-fatal conditions attached to a well-formed but degenerate result.
 */
public enum FunnelWarning {
    /** Nobody reached the first step. */
    ZERO_STEPS_REACHED,
    /** A breakdown was requested but no breakdown value matched. */
    EMPTY_BREAKDOWN,
    /** Nobody converted between the histogram's steps. */
    ZERO_SAMPLE_HISTOGRAM
}
