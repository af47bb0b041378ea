package dev.ebullient.gamemaster.combat;

import dev.ebullient.gamemaster.state.WorldStateException;

/**
 * An illegal combat transition, or a session whose invariants do not hold.
 */
public class InvalidCombatStateException extends WorldStateException {

    private final String sessionId;

    public InvalidCombatStateException(String sessionId, String message) {
        super(CombatEngine.DOMAIN, sessionId == null ? message : "[%s] %s".formatted(sessionId, message));
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
