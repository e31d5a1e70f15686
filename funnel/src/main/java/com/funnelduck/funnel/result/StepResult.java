package com.funnelduck.funnel.result;

import com.funnelduck.funnel.spec.StepKind;

/**
 * One step of one funnel partition.
 *
 * @param stepIndex 0-based position in the funnel
 * @param label the step's display label
 * @param kind event or action
 * @param actionId the action id for action steps, otherwise null
 * @param customName the step's custom name, or null
 * @param matchedCount people (or groups) who reached this step
 * @param averageConversionTimeSeconds average seconds from the previous step, null for step 0
 * @param medianConversionTimeSeconds median seconds from the previous step, null for step 0
 * @param breakdownLabel display label of the breakdown partition, or null
 * @param breakdownValue raw breakdown value of the partition, or null
 * @param convertedSelector the people who reached this step
 * @param droppedSelector the people who reached the previous step but not this one, null for step 0
 */
public record StepResult(int stepIndex,
                         String label,
                         StepKind kind,
                         Long actionId,
                         String customName,
                         long matchedCount,
                         Double averageConversionTimeSeconds,
                         Double medianConversionTimeSeconds,
                         String breakdownLabel,
                         Object breakdownValue,
                         DrillDownSelector convertedSelector,
                         DrillDownSelector droppedSelector) {
}
