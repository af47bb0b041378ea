package dev.ebullient.gamemaster.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import dev.ebullient.gamemaster.combat.CombatResolution;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnResult(
        long version,
        @JsonProperty("assigned_ids") List<String> assignedIds,
        List<String> notices,
        @JsonProperty("combat_resolution") CombatResolution combatResolution) {

    public TurnResult {
        assignedIds = assignedIds == null ? List.of() : List.copyOf(assignedIds);
        notices = notices == null ? List.of() : List.copyOf(notices);
    }
}
