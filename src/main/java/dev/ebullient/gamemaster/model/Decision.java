package dev.ebullient.gamemaster.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import dev.ebullient.gamemaster.combat.CombatOutcome;
import dev.ebullient.gamemaster.combat.CombatantSetup;

/**
 * Opaque decisions made by the external author for one turn. The engine never makes
 * these itself; it applies their consequences consistently.
 */
public record Decision(
        @JsonProperty("in_combat") Boolean inCombat,
        @JsonProperty("combat_location") String combatLocation,
        List<CombatantSetup> combatants,
        @JsonProperty("combat_outcome") CombatOutcome combatOutcome,
        @JsonProperty("xp_award") Integer xpAward,
        @JsonProperty("xp_reason") String xpReason,
        @JsonProperty("level_up") boolean levelUp,
        @JsonProperty("planning_check") PlanningCheck planningCheck) {

    public static final Decision NONE = new Decision(null, null, List.of(), null, null, null, false, null);

    public Decision {
        combatants = combatants == null ? List.of() : List.copyOf(combatants);
    }

    public boolean startsCombat() {
        return Boolean.TRUE.equals(inCombat) && !combatants.isEmpty();
    }

    /** True when the author reports combat is over without naming an outcome. */
    public boolean leftCombat() {
        return Boolean.FALSE.equals(inCombat) && combatOutcome == null;
    }

    public static Decision startCombat(String location, List<CombatantSetup> combatants) {
        return new Decision(true, location, combatants, null, null, null, false, null);
    }

    public static Decision endCombat(CombatOutcome outcome) {
        return new Decision(false, null, List.of(), outcome, null, null, false, null);
    }

    public static Decision awardXp(int amount, String reason) {
        return new Decision(null, null, List.of(), null, amount, reason, false, null);
    }

    public static Decision requestLevelUp() {
        return new Decision(null, null, List.of(), null, null, null, true, null);
    }

    public static Decision planning(PlanningCheck check) {
        return new Decision(null, null, List.of(), null, null, null, false, check);
    }
}
