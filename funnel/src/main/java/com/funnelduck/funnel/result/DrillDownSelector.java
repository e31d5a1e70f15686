package com.funnelduck.funnel.result;

/**
 * Describes a person list behind a funnel step.
 *
 * <p>{@code funnelStep} is 1-based: {@code +k} selects people who reached step {@code k},
 * {@code -k} people who reached step {@code k - 1} but not step {@code k}.
 *
 * @param funnelStep the signed 1-based step
 * @param breakdownValue the breakdown partition, or null without a breakdown
 */
public record DrillDownSelector(int funnelStep, Object breakdownValue) {

    public DrillDownSelector {
        if (funnelStep == 0 || funnelStep == -1) {
            throw new IllegalArgumentException("funnelStep must be positive or at most -2, got " + funnelStep);
        }
    }

    public static DrillDownSelector converted(int stepIndex, Object breakdownValue) {
        return new DrillDownSelector(stepIndex + 1, breakdownValue);
    }

    public static DrillDownSelector dropped(int stepIndex, Object breakdownValue) {
        return new DrillDownSelector(-(stepIndex + 1), breakdownValue);
    }

    public boolean isDropOff() {
        return funnelStep < 0;
    }

    /**
     * The 1-based step this selector is about.
     */
    public int step() {
        return Math.abs(funnelStep);
    }
}
