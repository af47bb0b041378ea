package dev.ebullient.gamemaster.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A request to issue (or confirm) an entity id. {@code existingId} is set when the
 * entity already carries one.
 */
public record EntityRegistration(
        EntityKind kind,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("existing_id") String existingId) {

    public EntityRegistration(EntityKind kind, String displayName) {
        this(kind, displayName, null);
    }
}
