package dev.ebullient.gamemaster.entity;

import dev.ebullient.gamemaster.state.SchemaViolationException;

/**
 * An edge in a patch points at an entity id the registry never issued.
 */
public class UnregisteredEntityException extends SchemaViolationException {

    private final String entityId;

    public UnregisteredEntityException(String path, String entityId) {
        super(path, "registered entity id", entityId,
                "Unregistered entity %s referenced at %s".formatted(entityId, path));
        this.entityId = entityId;
    }

    public String entityId() {
        return entityId;
    }
}
