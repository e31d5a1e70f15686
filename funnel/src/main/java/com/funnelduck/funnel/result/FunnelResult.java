package com.funnelduck.funnel.result;

import java.util.List;
import java.util.Objects;

/**
 * A formatted funnel: one list of steps per breakdown partition, a single one without a breakdown.
 */
public record FunnelResult(List<List<StepResult>> partitions, List<FunnelWarning> warnings) {

    public FunnelResult {
        Objects.requireNonNull(partitions, "partitions must not be null");
        partitions = partitions.stream().map(List::copyOf).toList();
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
    }

    public boolean isEmpty() {
        return partitions.isEmpty();
    }

    /**
     * The only partition of a funnel without a breakdown.
     */
    public List<StepResult> steps() {
        if (partitions.size() != 1) {
            throw new IllegalStateException("funnel has " + partitions.size() + " partitions");
        }
        return partitions.get(0);
    }
}
