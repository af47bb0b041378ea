package dev.ebullient.gamemaster.combat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CombatPhase {
    IDLE,
    INITIATING,
    ACTIVE,
    ENDED,
    FLED;

    public boolean isLive() {
        return this == INITIATING || this == ACTIVE;
    }

    public boolean isTerminal() {
        return this == ENDED || this == FLED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static CombatPhase fromValue(String value) {
        if (value == null || value.isBlank()) {
            return IDLE;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
