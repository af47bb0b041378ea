package dev.ebullient.gamemaster.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the corrective operations that turn one world tree into another.
 */
public final class RecoveryDiff {

    private RecoveryDiff() {
    }

    /**
     * @return {@code GOD_MODE_SET:} text that transforms {@code actual} into {@code expected}
     */
    public static String between(WorldState actual, Map<String, Object> expected) {
        StringBuilder sb = new StringBuilder(GodModeParser.HEADER);
        for (String line : PatchFormatter.lines(ops(actual.tree(), expected))) {
            sb.append('\n').append(line);
        }
        return sb.toString();
    }

    public static List<PatchOp> ops(Map<String, Object> actual, Map<String, Object> expected) {
        List<PatchOp> ops = new ArrayList<>();
        for (Map.Entry<String, Object> domain : actual.entrySet()) {
            if (!expected.containsKey(domain.getKey()) && domain.getValue() instanceof Map<?, ?> children) {
                // domains are never removed, only emptied
                children.keySet().forEach(k -> ops.add(new PatchOp.Delete(domain.getKey() + "." + k)));
            }
        }
        diffInto("", actual, expected, ops);
        return ops;
    }

    private static void diffInto(String prefix, Map<?, ?> actual, Map<?, ?> expected, List<PatchOp> ops) {
        for (Object key : actual.keySet()) {
            if (!expected.containsKey(key) && !prefix.isEmpty()) {
                ops.add(new PatchOp.Delete(StatePaths.join(prefix, String.valueOf(key))));
            }
        }
        for (Map.Entry<?, ?> entry : expected.entrySet()) {
            String path = StatePaths.join(prefix, String.valueOf(entry.getKey()));
            Object was = actual.get(entry.getKey());
            Object want = entry.getValue();
            if (was instanceof Map<?, ?> wasMap && want instanceof Map<?, ?> wantMap) {
                diffInto(path, wasMap, wantMap, ops);
            } else if (!actual.containsKey(entry.getKey()) || !Objects.equals(was, want)) {
                ops.add(new PatchOp.Assign(path, want));
            }
        }
    }
}
