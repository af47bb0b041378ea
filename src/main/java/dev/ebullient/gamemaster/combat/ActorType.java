package dev.ebullient.gamemaster.combat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared in initiative tie-break order: pc, ally, enemy, neutral.
 */
public enum ActorType {
    PC,
    ALLY,
    ENEMY,
    NEUTRAL;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ActorType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NEUTRAL;
        }
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "pc", "player" -> PC;
            case "ally", "companion" -> ALLY;
            case "enemy" -> ENEMY;
            case "neutral" -> NEUTRAL;
            default -> throw new IllegalArgumentException("Unknown actor type: " + value);
        };
    }
}
