package com.funnelduck.funnel.actors;

import com.funnelduck.funnel.step.RecordingField;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A person (or group) behind a funnel step.
 *
 * @param actorId the aggregation target
 * @param stepsReached 1-based number of steps reached
 * @param breakdownValue the breakdown partition, or null
 * @param matchedRecordings per recording field, the distinct values matched at each step
 *                          (index = step index); empty unless recordings were requested
 */
public record FunnelActor(String actorId,
                          int stepsReached,
                          Object breakdownValue,
                          Map<RecordingField, List<List<String>>> matchedRecordings) {

    public FunnelActor {
        Objects.requireNonNull(actorId, "actorId must not be null");
        matchedRecordings = Map.copyOf(Objects.requireNonNull(matchedRecordings, "matchedRecordings must not be null"));
    }

    /**
     * Distinct session ids matched at a step.
     */
    public List<String> matchedSessions(int stepIndex) {
        List<List<String>> sessions = matchedRecordings.get(RecordingField.SESSION_ID);
        return sessions == null ? List.of() : sessions.get(stepIndex);
    }
}
