package dev.ebullient.gamemaster.state;

import java.util.List;

/**
 * Append-only audit record of one committed version.
 */
public record ChangelogEntry(
        long version,
        PatchSource source,
        List<PatchOp> ops,
        String committedAt,
        String note) {

    public ChangelogEntry {
        ops = ops == null ? List.of() : List.copyOf(ops);
    }
}
