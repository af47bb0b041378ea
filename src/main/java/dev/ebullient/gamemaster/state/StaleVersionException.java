package dev.ebullient.gamemaster.state;

/**
 * The patch was computed against an older snapshot. Re-read the state and recompute.
 */
public class StaleVersionException extends WorldStateException {

    private final long submittedVersion;
    private final long currentVersion;

    public StaleVersionException(long submittedVersion, long currentVersion) {
        super(null, "Patch computed against game_state_version %d, but current version is %d"
                .formatted(submittedVersion, currentVersion));
        this.submittedVersion = submittedVersion;
        this.currentVersion = currentVersion;
    }

    public long submittedVersion() {
        return submittedVersion;
    }

    public long currentVersion() {
        return currentVersion;
    }
}
