package dev.ebullient.gamemaster.combat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read view of one entry under {@code combat_state.combatants}.
 */
public record Combatant(
        @JsonProperty("actor_id") String actorId,
        ActorType type,
        @JsonProperty("hp_current") int hpCurrent,
        @JsonProperty("hp_max") int hpMax,
        @JsonProperty("armor_class") int armorClass,
        String cr,
        List<String> status,
        @JsonProperty("damage_modifiers") Map<DamageType, DamageResponse> damageModifiers) {

    public static final String DEFEATED = "defeated";
    public static final String SURRENDERED = "surrendered";

    public Combatant {
        status = status == null ? List.of() : List.copyOf(status);
        damageModifiers = damageModifiers == null ? Map.of() : Map.copyOf(damageModifiers);
    }

    @JsonIgnore
    public boolean isDefeated() {
        return status.contains(DEFEATED);
    }

    @JsonIgnore
    public boolean isSurrendered() {
        return status.contains(SURRENDERED);
    }

    /** Defeated and surrendered combatants no longer take turns. */
    @JsonIgnore
    public boolean canAct() {
        return !isDefeated() && !isSurrendered();
    }

    public int effectiveDamage(int amount, DamageType type) {
        DamageResponse response = damageModifiers.get(type);
        return response == null ? amount : response.apply(amount);
    }

    List<String> statusWith(String marker) {
        List<String> result = new ArrayList<>(status);
        if (!result.contains(marker)) {
            result.add(marker);
        }
        return result;
    }

    List<String> statusWithout(String marker) {
        List<String> result = new ArrayList<>(status);
        result.remove(marker);
        return result;
    }

    static Combatant fromSetup(CombatantSetup setup) {
        int hp = setup.hpCurrent() == null ? setup.hpMax() : setup.hpCurrent();
        return new Combatant(setup.actorId(), setup.type(), hp, setup.hpMax(), setup.armorClass(), setup.cr(),
                hp == 0 ? List.of(DEFEATED) : List.of(), setup.damageModifiers());
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.value());
        map.put("hp_current", hpCurrent);
        map.put("hp_max", hpMax);
        map.put("armor_class", armorClass);
        if (cr != null) {
            map.put("cr", cr);
        }
        map.put("status", new ArrayList<>(status));
        if (!damageModifiers.isEmpty()) {
            Map<String, Object> modifiers = new LinkedHashMap<>();
            damageModifiers.forEach((k, v) -> modifiers.put(k.value(), v.value()));
            map.put("damage_modifiers", modifiers);
        }
        return map;
    }

    static Combatant fromMap(String actorId, Map<?, ?> map) {
        List<String> status = new ArrayList<>();
        if (map.get("status") instanceof List<?> list) {
            list.forEach(s -> status.add(String.valueOf(s)));
        } else if (map.get("status") instanceof String s) {
            status.add(s);
        }
        Map<DamageType, DamageResponse> modifiers = new LinkedHashMap<>();
        if (map.get("damage_modifiers") instanceof Map<?, ?> table) {
            table.forEach((k, v) -> modifiers.put(DamageType.fromValue(String.valueOf(k)),
                    DamageResponse.fromValue(String.valueOf(v))));
        }
        Object cr = map.get("cr");
        return new Combatant(actorId,
                ActorType.fromValue(map.get("type") instanceof String s ? s : null),
                intValue(map.get("hp_current")),
                intValue(map.get("hp_max")),
                intValue(map.get("armor_class")),
                cr == null ? null : String.valueOf(cr),
                status, modifiers);
    }

    private static int intValue(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }
}
