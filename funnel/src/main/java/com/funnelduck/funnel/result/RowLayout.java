package com.funnelduck.funnel.result;

/**
 * Column positions of a funnel result row:
 * {@code [step_1_count .. step_N_count, avg_1 .. avg_N-1, median_1 .. median_N-1, prop?]}.
 *
 * <p>Counts are per exact step count reached, not cumulative.
 */
public record RowLayout(int stepCount, boolean hasBreakdown) {

    public RowLayout {
        if (stepCount < 1) {
            throw new IllegalArgumentException("stepCount must be positive");
        }
    }

    /**
     * @param stepsReached 1-based number of steps reached
     */
    public int countIndex(int stepsReached) {
        return stepsReached - 1;
    }

    public int averageIndex(int stepIndex) {
        requireConversionStep(stepIndex);
        return stepCount + stepIndex - 1;
    }

    public int medianIndex(int stepIndex) {
        requireConversionStep(stepIndex);
        return 2 * stepCount + stepIndex - 2;
    }

    public int propIndex() {
        if (!hasBreakdown) {
            throw new IllegalStateException("no breakdown column");
        }
        return 3 * stepCount - 2;
    }

    public int width() {
        return 3 * stepCount - 2 + (hasBreakdown ? 1 : 0);
    }

    private void requireConversionStep(int stepIndex) {
        if (stepIndex < 1 || stepIndex >= stepCount) {
            throw new IllegalArgumentException("no conversion time for step " + stepIndex);
        }
    }
}
