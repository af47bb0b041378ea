package dev.ebullient.gamemaster.state;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Parses out-of-band corrections:
 *
 * <pre>
 * GOD_MODE_SET:
 * player_character_data.hp_current = 12
 * npc_data.npc_mara_001.status = "hostile"
 * world_data.weather = __DELETE__
 * custom_campaign_state.core_memories.append = "the bridge fell"
 * </pre>
 *
 * Any malformed line rejects the whole correction.
 */
public final class GodModeParser {

    public static final String HEADER = "GOD_MODE_SET:";
    static final String APPEND_SUFFIX = "." + PatchParser.APPEND_KEY;

    private GodModeParser() {
    }

    public static boolean isCorrection(String text) {
        return text != null && text.stripLeading().startsWith(HEADER);
    }

    public static List<PatchOp> parse(String text) {
        if (!isCorrection(text)) {
            throw new SchemaViolationException("", HEADER + " header", "missing header");
        }
        String body = text.stripLeading().substring(HEADER.length());
        List<PatchOp> ops = new ArrayList<>();
        int lineNo = 1;
        for (String raw : body.split("\\R")) {
            String line = raw.strip();
            if (!line.isEmpty() && !line.startsWith("#")) {
                ops.add(parseLine(line, lineNo));
            }
            lineNo++;
        }
        return ops;
    }

    static PatchOp parseLine(String line, int lineNo) {
        int eq = line.indexOf('=');
        if (eq <= 0) {
            throw new SchemaViolationException("", "path = <json-literal>", "line %d: %s".formatted(lineNo, line));
        }
        String path = line.substring(0, eq).strip();
        String literal = line.substring(eq + 1).strip();
        if (path.contains(" ") || literal.isEmpty()) {
            throw new SchemaViolationException(path, "path = <json-literal>", "line %d: %s".formatted(lineNo, line));
        }
        StatePaths.split(path);

        if (PatchParser.DELETE_SENTINEL.equals(literal)) {
            return new PatchOp.Delete(path);
        }
        Object value;
        try {
            value = PatchFormatter.JSON.readValue(literal, Object.class);
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException(path, "JSON literal", "line %d: %s".formatted(lineNo, literal));
        }
        if (path.endsWith(APPEND_SUFFIX)) {
            List<Object> items = new ArrayList<>(1);
            items.add(value);
            return new PatchOp.Append(path.substring(0, path.length() - APPEND_SUFFIX.length()), items);
        }
        return new PatchOp.Assign(path, value);
    }
}
