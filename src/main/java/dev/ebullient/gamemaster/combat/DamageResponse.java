package dev.ebullient.gamemaster.combat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a combatant responds to one damage type.
 */
public enum DamageResponse {
    RESISTANT,
    VULNERABLE,
    IMMUNE;

    /**
     * Scaled damage, saturating at {@link Integer#MAX_VALUE}.
     */
    public int apply(int amount) {
        return switch (this) {
            case RESISTANT -> amount / 2;
            case VULNERABLE -> (int) Math.min(Integer.MAX_VALUE, 2L * amount);
            case IMMUNE -> 0;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DamageResponse fromValue(String value) {
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "resistant", "resistance" -> RESISTANT;
            case "vulnerable", "vulnerability" -> VULNERABLE;
            case "immune", "immunity" -> IMMUNE;
            default -> throw new IllegalArgumentException("Unknown damage response: " + value);
        };
    }
}
