package dev.ebullient.gamemaster.planning;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FrozenPlan(
        @JsonProperty("topic_key") String topicKey,
        @JsonProperty("failed_at") Instant failedAt,
        @JsonProperty("freeze_until") Instant freezeUntil,
        @JsonProperty("original_difficulty") int originalDifficulty,
        @JsonProperty("freeze_hours") int freezeHours,
        String description) {

    public boolean isFrozenAt(Instant now) {
        return now.isBefore(freezeUntil);
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("failed_at", failedAt.toString());
        map.put("freeze_until", freezeUntil.toString());
        map.put("original_difficulty", originalDifficulty);
        map.put("freeze_hours", freezeHours);
        if (description != null) {
            map.put("description", description);
        }
        return map;
    }

    static FrozenPlan fromMap(String topicKey, Map<?, ?> map) {
        return new FrozenPlan(topicKey,
                Instant.parse(String.valueOf(map.get("failed_at"))),
                Instant.parse(String.valueOf(map.get("freeze_until"))),
                map.get("original_difficulty") instanceof Number n ? n.intValue() : 0,
                map.get("freeze_hours") instanceof Number h ? h.intValue() : 0,
                map.get("description") instanceof String d ? d : null);
    }
}
