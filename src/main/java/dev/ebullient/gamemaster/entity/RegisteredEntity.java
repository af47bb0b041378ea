package dev.ebullient.gamemaster.entity;

import java.util.Map;
import java.util.Objects;

public record RegisteredEntity(
        String id,
        EntityKind kind,
        String displayName,
        long registeredVersion,
        boolean deleted) {

    static RegisteredEntity fromEntry(String id, Map<?, ?> entry) {
        return new RegisteredEntity(id,
                EntityKind.fromPrefix(String.valueOf(entry.get("kind"))),
                Objects.toString(entry.get("display_name"), id),
                entry.get("registered_version") instanceof Number n ? n.longValue() : 0,
                Boolean.TRUE.equals(entry.get("deleted")));
    }
}
