package dev.ebullient.gamemaster.state;

/**
 * Base type for every rejection raised by the world state engine.
 * Carries the offending dot-path when one is known so callers can correct and resubmit.
 */
public class WorldStateException extends RuntimeException {

    private final String path;

    public WorldStateException(String path, String message) {
        super(message);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
