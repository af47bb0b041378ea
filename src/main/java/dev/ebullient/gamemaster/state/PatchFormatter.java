package dev.ebullient.gamemaster.state;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders patch operations as {@code path = <json-literal>} lines, the same
 * format {@link GodModeParser} reads back.
 */
public final class PatchFormatter {

    static final ObjectMapper JSON = new ObjectMapper();

    private PatchFormatter() {
    }

    public static String summary(List<PatchOp> ops) {
        return "Game state updated (%d entries)".formatted(lines(ops).size());
    }

    public static String describe(List<PatchOp> ops) {
        List<String> lines = lines(ops);
        StringBuilder sb = new StringBuilder();
        sb.append("Game state updated (%d entries):".formatted(lines.size()));
        for (String line : lines) {
            sb.append("\n  ").append(line);
        }
        return sb.toString();
    }

    public static List<String> lines(List<PatchOp> ops) {
        List<String> lines = new ArrayList<>();
        for (PatchOp op : ops) {
            lines.addAll(lines(op));
        }
        return lines;
    }

    public static List<String> lines(PatchOp op) {
        if (op instanceof PatchOp.Assign assign) {
            return List.of(assign.path() + " = " + literal(assign.value()));
        }
        if (op instanceof PatchOp.Delete delete) {
            return List.of(delete.path() + " = " + PatchParser.DELETE_SENTINEL);
        }
        PatchOp.Append append = (PatchOp.Append) op;
        List<String> lines = new ArrayList<>(append.items().size());
        for (Object item : append.items()) {
            lines.add(append.path() + "." + PatchParser.APPEND_KEY + " = " + literal(item));
        }
        return lines;
    }

    public static String literal(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not representable as JSON: " + value, e);
        }
    }
}
