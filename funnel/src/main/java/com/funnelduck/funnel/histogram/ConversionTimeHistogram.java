package com.funnelduck.funnel.histogram;

import com.funnelduck.funnel.result.FunnelWarning;

import java.util.List;
import java.util.Objects;

/**
 * Distribution of conversion times between two funnel steps.
 *
 * @param bins contiguous bins in ascending order, empty when nobody converted
 * @param averageConversionTimeSeconds mean over all samples, null when nobody converted
 * @param warnings degenerate input warnings
 */
public record ConversionTimeHistogram(List<HistogramBin> bins,
                                      Double averageConversionTimeSeconds,
                                      List<FunnelWarning> warnings) {

    public ConversionTimeHistogram {
        bins = List.copyOf(Objects.requireNonNull(bins, "bins must not be null"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
    }

    public long totalCount() {
        return bins.stream().mapToLong(HistogramBin::personCount).sum();
    }
}
