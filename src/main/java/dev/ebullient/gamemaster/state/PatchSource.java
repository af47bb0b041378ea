package dev.ebullient.gamemaster.state;

public enum PatchSource {
    /** Proposed by the external author for this turn */
    AUTHOR,
    /** Deterministic consequence computed by an engine component */
    ENGINE,
    /** Out-of-band GOD_MODE_SET correction */
    RECOVERY,
    /** Re-commit of an earlier snapshot */
    ROLLBACK
}
