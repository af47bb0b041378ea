package dev.ebullient.gamemaster.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EntityKind {
    PC("pc"),
    NPC("npc"),
    LOCATION("loc"),
    ITEM("item"),
    FACTION("faction");

    private final String prefix;

    EntityKind(String prefix) {
        this.prefix = prefix;
    }

    @JsonValue
    public String prefix() {
        return prefix;
    }

    @JsonCreator
    public static EntityKind fromPrefix(String value) {
        for (EntityKind kind : values()) {
            if (kind.prefix.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + value);
    }
}
