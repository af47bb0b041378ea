package dev.ebullient.gamemaster.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a campaign's world state at one {@code game_state_version}.
 */
public record WorldState(long version, Map<String, Object> tree) {

    public static final String VERSION_KEY = "game_state_version";
    public static final long INITIAL_VERSION = 1;

    public WorldState {
        if (version < INITIAL_VERSION) {
            throw new IllegalArgumentException("game_state_version must be >= 1, got " + version);
        }
        tree = StateTrees.frozenCopyOf(tree == null ? Map.of() : tree);
    }

    /**
     * A fresh state with every declared domain present and empty.
     */
    public static WorldState initial(PathSchema schema) {
        Map<String, Object> tree = new LinkedHashMap<>();
        for (String domain : schema.domains()) {
            tree.put(domain, new LinkedHashMap<>());
        }
        tree.put("combat_state", Map.of("in_combat", false, "phase", "idle"));
        return new WorldState(INITIAL_VERSION, tree);
    }

    /**
     * Rebuild a snapshot from its persisted document form (domains plus {@code game_state_version}).
     */
    public static WorldState fromDocument(Map<String, Object> document) {
        Map<String, Object> tree = new LinkedHashMap<>(document);
        Object version = tree.remove(VERSION_KEY);
        long v = version instanceof Number n ? n.longValue() : INITIAL_VERSION;
        return new WorldState(v, tree);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(VERSION_KEY, version);
        document.putAll(tree);
        return document;
    }

    /**
     * Resolve a dot-path across domains. An empty result means NotFound; a present
     * JSON null is reported as NotFound as well.
     */
    public Optional<Object> get(String path) {
        Object current = tree;
        for (String segment : StatePaths.split(path)) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    public boolean contains(String path) {
        return get(path).isPresent();
    }

    public Map<String, Object> getMap(String path) {
        Object value = get(path).orElse(null);
        return value instanceof Map<?, ?> map
                ? Collections.unmodifiableMap(StateTrees.keyed(map))
                : Map.of();
    }

    public List<Object> getList(String path) {
        Object value = get(path).orElse(null);
        return value instanceof List<?> list
                ? Collections.unmodifiableList(list)
                : List.of();
    }

    public Optional<String> getString(String path) {
        return get(path).filter(String.class::isInstance).map(String.class::cast);
    }

    public Optional<Integer> getInt(String path) {
        return get(path).filter(Number.class::isInstance).map(v -> ((Number) v).intValue());
    }

    public int getInt(String path, int defaultValue) {
        return getInt(path).orElse(defaultValue);
    }

    public boolean getBoolean(String path) {
        return get(path).map(Boolean.TRUE::equals).orElse(false);
    }
}
