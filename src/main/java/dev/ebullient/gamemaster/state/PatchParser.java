package dev.ebullient.gamemaster.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts the external JSON patch format into {@link PatchOp}s.
 * <ul>
 * <li>nested objects and dotted keys both address nested paths</li>
 * <li>{@code "__DELETE__"} removes the key</li>
 * <li>{@code {"append": X}} appends X (or each element of X) to a list</li>
 * <li>an empty object means "ensure this object exists"</li>
 * </ul>
 */
public class PatchParser {

    public static final String DELETE_SENTINEL = "__DELETE__";
    public static final String APPEND_KEY = "append";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PatchParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Patch parse(long baseVersion, String json) {
        try {
            return parse(baseVersion, objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("", "JSON object", "unparseable text: " + e.getOriginalMessage());
        }
    }

    public Patch parse(long baseVersion, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new Patch(baseVersion, List.of(), PatchSource.AUTHOR);
        }
        if (!node.isObject()) {
            throw new SchemaViolationException("", "JSON object", node.getNodeType().name().toLowerCase());
        }
        Map<String, Object> changes = objectMapper.convertValue(node, MAP_TYPE);
        return new Patch(baseVersion, flatten("", changes), PatchSource.AUTHOR);
    }

    /**
     * Flatten a (possibly nested, possibly dotted) change map rooted at {@code prefix} into leaf operations,
     * preserving key order.
     */
    public static List<PatchOp> flatten(String prefix, Map<?, ?> changes) {
        List<PatchOp> ops = new ArrayList<>();
        flattenInto(prefix, changes, ops);
        return ops;
    }

    private static void flattenInto(String prefix, Map<?, ?> changes, List<PatchOp> ops) {
        for (Map.Entry<?, ?> entry : changes.entrySet()) {
            String path = StatePaths.join(prefix, String.valueOf(entry.getKey()));
            StatePaths.split(path); // reject malformed dotted keys early
            Object value = entry.getValue();

            if (DELETE_SENTINEL.equals(value)) {
                ops.add(new PatchOp.Delete(path));
            } else if (isAppend(value)) {
                Object items = ((Map<?, ?>) value).get(APPEND_KEY);
                ops.add(new PatchOp.Append(path, items instanceof List<?> list
                        ? new ArrayList<>(list)
                        : singleton(items)));
            } else if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
                flattenInto(path, nested, ops);
            } else {
                ops.add(new PatchOp.Assign(path, value));
            }
        }
    }

    static boolean isAppend(Object value) {
        return value instanceof Map<?, ?> map && map.size() == 1 && map.containsKey(APPEND_KEY);
    }

    private static List<Object> singleton(Object item) {
        List<Object> list = new ArrayList<>(1);
        list.add(item);
        return list;
    }
}
