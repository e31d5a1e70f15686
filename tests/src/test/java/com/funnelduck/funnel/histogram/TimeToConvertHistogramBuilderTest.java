package com.funnelduck.funnel.histogram;

import com.funnelduck.funnel.result.FunnelWarning;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Conversion time histograms")
public class TimeToConvertHistogramBuilderTest extends TestBase {

    private final TimeToConvertHistogramBuilder builder = new TimeToConvertHistogramBuilder();

    @ParameterizedTest(name = "{0} samples, requested {1} -> {2} bins")
    @CsvSource({
        "1, , 3",
        "60, , 4",
        "999, , 10",
        "1000000, , 60",
        "5, 0, 1",
        "5, 7, 7",
        "5, 500, 90"
    })
    void testBinCount(int samples, Integer requested, int expected) {
        assertThat(TimeToConvertHistogramBuilder.binCount(samples, requested)).isEqualTo(expected);
    }

    @Test
    @DisplayName("bins are contiguous and one wider than the requested count")
    void testContiguousBins() {
        List<Double> samples = List.of(10.0, 20.0, 30.0, 40.0, 100.0);

        ConversionTimeHistogram histogram = builder.build(samples, 3);
        logData("Bins", histogram.bins());

        assertThat(histogram.bins()).hasSize(4);
        for (int i = 1; i < histogram.bins().size(); i++) {
            assertThat(histogram.bins().get(i).fromSeconds()).isEqualTo(histogram.bins().get(i - 1).toSeconds());
        }
        assertThat(histogram.bins().get(0)).isEqualTo(new HistogramBin(10, 40, 3));
        assertThat(histogram.bins().get(1)).isEqualTo(new HistogramBin(40, 70, 1));
        assertThat(histogram.bins().get(3)).isEqualTo(new HistogramBin(100, 130, 1));
        assertThat(histogram.averageConversionTimeSeconds()).isEqualTo(40.0);
    }

    @Test
    @DisplayName("every sample lands in exactly one bin")
    void testConservation() {
        List<Double> samples = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            samples.add((i * 37 % 1000) + 0.5);
        }

        ConversionTimeHistogram histogram = builder.build(samples, null);

        assertThat(histogram.totalCount()).isEqualTo(500);
        assertThat(histogram.warnings()).isEmpty();
    }

    @Test
    @DisplayName("identical samples fall back to one minute bins")
    void testZeroRange() {
        ConversionTimeHistogram histogram = builder.build(List.of(42.0, 42.0), 2);

        assertThat(histogram.bins()).containsExactly(
            new HistogramBin(42, 102, 2),
            new HistogramBin(102, 162, 0),
            new HistogramBin(162, 222, 0));
    }

    @Test
    void testNoSamples() {
        ConversionTimeHistogram histogram = builder.build(List.of(), null);

        assertThat(histogram.bins()).isEmpty();
        assertThat(histogram.averageConversionTimeSeconds()).isNull();
        assertThat(histogram.warnings()).containsExactly(FunnelWarning.ZERO_SAMPLE_HISTOGRAM);
    }
}
