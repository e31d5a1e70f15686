package com.funnelduck.funnel.histogram;

/**
 * Targets whose conversion time falls in {@code [fromSeconds, toSeconds)}.
 */
public record HistogramBin(long fromSeconds, long toSeconds, long personCount) {
}
