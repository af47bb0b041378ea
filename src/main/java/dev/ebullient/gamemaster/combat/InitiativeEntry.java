package dev.ebullient.gamemaster.combat;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InitiativeEntry(
        @JsonProperty("actor_id") String actorId,
        @JsonProperty("initiative_score") Integer initiativeScore,
        ActorType type) {

    /**
     * Highest score first; ties by actor type (pc, ally, enemy, neutral), then by id.
     */
    public static final Comparator<InitiativeEntry> TURN_ORDER = Comparator
            .comparing(InitiativeEntry::initiativeScore, Comparator.nullsLast(Comparator.<Integer>reverseOrder()))
            .thenComparing(InitiativeEntry::type)
            .thenComparing(InitiativeEntry::actorId);

    public InitiativeEntry withScore(int score) {
        return new InitiativeEntry(actorId, score, type);
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("actor_id", actorId);
        map.put("initiative_score", initiativeScore);
        map.put("type", type.value());
        return map;
    }

    static InitiativeEntry fromMap(Map<?, ?> map) {
        Object score = map.get("initiative_score");
        return new InitiativeEntry(String.valueOf(map.get("actor_id")),
                score instanceof Number n ? n.intValue() : null,
                ActorType.fromValue(map.get("type") instanceof String s ? s : null));
    }
}
