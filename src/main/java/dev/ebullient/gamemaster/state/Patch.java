package dev.ebullient.gamemaster.state;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A structurally-typed, partial update computed against a specific {@code game_state_version}.
 */
public record Patch(long baseVersion, List<PatchOp> ops, PatchSource source) {

    public Patch {
        ops = List.copyOf(ops);
        if (source == null) {
            source = PatchSource.AUTHOR;
        }
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    public static Builder against(WorldState snapshot) {
        return new Builder(snapshot.version(), PatchSource.ENGINE);
    }

    public static Builder against(long baseVersion, PatchSource source) {
        return new Builder(baseVersion, source);
    }

    public static class Builder {
        private final long baseVersion;
        private final PatchSource source;
        private final List<PatchOp> ops = new ArrayList<>();

        Builder(long baseVersion, PatchSource source) {
            this.baseVersion = baseVersion;
            this.source = source;
        }

        public Builder set(String path, Object value) {
            ops.add(new PatchOp.Assign(path, value));
            return this;
        }

        /**
         * Merge every entry of {@code values} under {@code path}, leaving other keys untouched.
         */
        public Builder merge(String path, Map<String, ?> values) {
            ops.add(new PatchOp.Assign(path, values));
            return this;
        }

        public Builder delete(String path) {
            ops.add(new PatchOp.Delete(path));
            return this;
        }

        public Builder append(String path, Object... items) {
            ops.add(new PatchOp.Append(path, Arrays.asList(items)));
            return this;
        }

        public Builder appendAll(String path, List<?> items) {
            ops.add(new PatchOp.Append(path, new ArrayList<>(items)));
            return this;
        }

        public Builder add(PatchOp op) {
            ops.add(op);
            return this;
        }

        public Builder addAll(List<PatchOp> more) {
            ops.addAll(more);
            return this;
        }

        public boolean isEmpty() {
            return ops.isEmpty();
        }

        public Patch build() {
            return new Patch(baseVersion, ops, source);
        }
    }
}
