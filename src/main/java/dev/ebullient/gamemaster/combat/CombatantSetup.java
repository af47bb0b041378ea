package dev.ebullient.gamemaster.combat;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One participant as declared when combat starts. {@code initiative} may be left
 * null and supplied later; enemies must carry a challenge rating.
 */
public record CombatantSetup(
        @JsonProperty("actor_id") String actorId,
        ActorType type,
        @JsonProperty("hp_current") Integer hpCurrent,
        @JsonProperty("hp_max") int hpMax,
        @JsonProperty("armor_class") int armorClass,
        String cr,
        Integer initiative,
        @JsonProperty("damage_modifiers") Map<DamageType, DamageResponse> damageModifiers) {

    public CombatantSetup {
        if (type == null) {
            type = ActorType.NEUTRAL;
        }
        damageModifiers = damageModifiers == null ? Map.of() : Map.copyOf(damageModifiers);
    }

    public static CombatantSetup pc(String actorId, int hp, int armorClass, Integer initiative) {
        return new CombatantSetup(actorId, ActorType.PC, hp, hp, armorClass, null, initiative, Map.of());
    }

    public static CombatantSetup enemy(String actorId, int hp, int armorClass, String cr, Integer initiative) {
        return new CombatantSetup(actorId, ActorType.ENEMY, hp, hp, armorClass, cr, initiative, Map.of());
    }

    public CombatantSetup withDamageModifiers(Map<DamageType, DamageResponse> modifiers) {
        return new CombatantSetup(actorId, type, hpCurrent, hpMax, armorClass, cr, initiative, modifiers);
    }
}
