package dev.ebullient.gamemaster.combat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal decision supplied by the author.
 */
public enum CombatOutcome {
    ENDED(CombatPhase.ENDED),
    FLED(CombatPhase.FLED);

    private final CombatPhase phase;

    CombatOutcome(CombatPhase phase) {
        this.phase = phase;
    }

    public CombatPhase phase() {
        return phase;
    }

    @JsonValue
    public String value() {
        return phase.value();
    }

    @JsonCreator
    public static CombatOutcome fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }

    static CombatOutcome of(CombatPhase phase) {
        return phase == CombatPhase.FLED ? FLED : ENDED;
    }
}
