package dev.ebullient.gamemaster.state;

import java.util.Arrays;
import java.util.List;

/**
 * Dot-path helpers. Keys containing a literal dot are not addressable.
 */
public final class StatePaths {

    private StatePaths() {
    }

    public static List<String> split(String path) {
        if (path == null || path.isBlank()) {
            throw new SchemaViolationException(path, "dot-separated path", "empty path");
        }
        String[] segments = path.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new SchemaViolationException(path, "dot-separated path",
                        "leading, trailing, or repeated dots");
            }
        }
        return Arrays.asList(segments);
    }

    public static String join(String prefix, String key) {
        return prefix == null || prefix.isEmpty() ? key : prefix + "." + key;
    }

    public static String domainOf(String path) {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }

    public static String parentOf(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? "" : path.substring(0, dot);
    }

    public static String lastSegment(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }
}
