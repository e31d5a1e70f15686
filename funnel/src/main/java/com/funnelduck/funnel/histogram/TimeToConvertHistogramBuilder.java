package com.funnelduck.funnel.histogram;

import com.funnelduck.funnel.result.FunnelWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bins per-target conversion times.
 *
 * <p>The range {@code [floor(min), ceil(max)]} is split into {@code binCount} bins of
 * {@code ceil(range / binCount)} seconds (60 seconds when the range is empty), and one
 * more bin is appended so the maximum always has a bin. Empty bins are kept, so the
 * result is always {@code binCount + 1} contiguous bins.
 */
public class TimeToConvertHistogramBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TimeToConvertHistogramBuilder.class);

    public static final int MIN_AUTO_BINS = 3;
    public static final int MAX_AUTO_BINS = 60;
    public static final int MIN_EXPLICIT_BINS = 1;
    public static final int MAX_EXPLICIT_BINS = 90;
    public static final long FALLBACK_BIN_WIDTH_SECONDS = 60;

    /**
     * @param samples conversion time of each target, in seconds
     * @param requestedBinCount the requested bin count, or null to derive one from the sample size
     */
    public ConversionTimeHistogram build(List<Double> samples, Integer requestedBinCount) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.isEmpty()) {
            logger.info("No conversions to bin");
            return new ConversionTimeHistogram(List.of(), null, List.of(FunnelWarning.ZERO_SAMPLE_HISTOGRAM));
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (Double sample : samples) {
            min = Math.min(min, sample);
            max = Math.max(max, sample);
            sum += sample;
        }

        int binCount = binCount(samples.size(), requestedBinCount);
        long from = (long) Math.floor(min);
        long to = (long) Math.ceil(max);
        long width = (long) Math.ceil((double) (to - from) / binCount);
        if (width <= 0) {
            width = FALLBACK_BIN_WIDTH_SECONDS;
        }

        long[] counts = new long[binCount + 1];
        for (Double sample : samples) {
            int index = (int) Math.floor((sample - from) / width);
            counts[Math.min(index, binCount)]++;
        }

        List<HistogramBin> bins = new ArrayList<>(counts.length);
        for (int i = 0; i < counts.length; i++) {
            long start = from + i * width;
            bins.add(new HistogramBin(start, start + width, counts[i]));
        }
        logger.debug("Binned {} samples into {} bins of {} s", samples.size(), bins.size(), width);
        return new ConversionTimeHistogram(bins, sum / samples.size(), List.of());
    }

    static int binCount(int sampleCount, Integer requested) {
        if (requested != null) {
            return Math.max(MIN_EXPLICIT_BINS, Math.min(MAX_EXPLICIT_BINS, requested));
        }
        int derived = (int) Math.ceil(Math.cbrt(sampleCount));
        return Math.max(MIN_AUTO_BINS, Math.min(MAX_AUTO_BINS, derived));
    }
}
