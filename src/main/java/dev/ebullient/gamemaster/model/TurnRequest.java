package dev.ebullient.gamemaster.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.gamemaster.entity.EntityRegistration;

/**
 * One turn from the author: the version the patch was computed against, the patch in
 * its external JSON form, entities to register, and the turn's decisions.
 */
public record TurnRequest(
        @JsonProperty("base_version") long baseVersion,
        JsonNode patch,
        List<EntityRegistration> entities,
        Decision decision) {

    public TurnRequest {
        entities = entities == null ? List.of() : List.copyOf(entities);
        if (decision == null) {
            decision = Decision.NONE;
        }
    }
}
