package dev.ebullient.gamemaster.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import dev.ebullient.gamemaster.planning.BreakReason;

/**
 * Outcome of a planning-quality check on one topic. {@code breakReason} is set when the
 * author claims a condition that lifts an existing freeze on the topic.
 */
public record PlanningCheck(
        @JsonProperty("topic_key") String topicKey,
        int difficulty,
        boolean passed,
        String description,
        @JsonProperty("break_reason") BreakReason breakReason) {

    public static PlanningCheck failed(String topicKey, int difficulty, String description) {
        return new PlanningCheck(topicKey, difficulty, false, description, null);
    }
}
