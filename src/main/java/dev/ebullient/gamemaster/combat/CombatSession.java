package dev.ebullient.gamemaster.combat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

import dev.ebullient.gamemaster.state.WorldState;

/**
 * Read view of the live (or most recently finished) combat session.
 */
public record CombatSession(
        @JsonProperty("session_id") String sessionId,
        CombatPhase phase,
        @JsonProperty("in_combat") boolean inCombat,
        int round,
        @JsonProperty("turn_cursor") int turnCursor,
        @JsonProperty("initiative_order") List<InitiativeEntry> initiativeOrder,
        Map<String, Combatant> combatants,
        @JsonProperty("rewards_processed") boolean rewardsProcessed,
        String location) {

    public CombatSession {
        initiativeOrder = initiativeOrder == null ? List.of() : List.copyOf(initiativeOrder);
        combatants = combatants == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(combatants));
    }

    public static CombatSession from(WorldState state) {
        List<InitiativeEntry> order = new ArrayList<>();
        for (Object item : state.getList(CombatEngine.DOMAIN + ".initiative_order")) {
            if (item instanceof Map<?, ?> map) {
                order.add(InitiativeEntry.fromMap(map));
            }
        }
        Map<String, Combatant> combatants = new LinkedHashMap<>();
        state.getMap(CombatEngine.DOMAIN + ".combatants").forEach((id, value) -> {
            if (value instanceof Map<?, ?> map) {
                combatants.put(id, Combatant.fromMap(id, map));
            }
        });
        return new CombatSession(
                state.getString(CombatEngine.DOMAIN + ".session_id").orElse(null),
                CombatPhase.fromValue(state.getString(CombatEngine.DOMAIN + ".phase").orElse(null)),
                state.getBoolean(CombatEngine.DOMAIN + ".in_combat"),
                state.getInt(CombatEngine.DOMAIN + ".round", 0),
                state.getInt(CombatEngine.DOMAIN + ".turn_cursor", 0),
                order, combatants,
                state.getBoolean(CombatEngine.DOMAIN + ".rewards_processed"),
                state.getString(CombatEngine.DOMAIN + ".location").orElse(null));
    }

    public Optional<Combatant> combatant(String actorId) {
        return Optional.ofNullable(combatants.get(actorId));
    }

    /** The actor whose turn it is, while the session is active. */
    public Optional<String> currentActor() {
        if (phase != CombatPhase.ACTIVE || turnCursor >= initiativeOrder.size()) {
            return Optional.empty();
        }
        return Optional.of(initiativeOrder.get(turnCursor).actorId());
    }
}
