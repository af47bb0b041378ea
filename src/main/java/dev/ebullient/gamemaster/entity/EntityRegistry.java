package dev.ebullient.gamemaster.entity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.gamemaster.StringUtils;
import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.PatchOp;
import dev.ebullient.gamemaster.state.PathSchema;
import dev.ebullient.gamemaster.state.PathSchema.ReferenceMode;
import dev.ebullient.gamemaster.state.PathSchema.ReferenceRule;
import dev.ebullient.gamemaster.state.StatePaths;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldState;

/**
 * Issues and validates entity ids of the form {@code {prefix}_{slug}_{nnn}}.
 * Issued ids are recorded in the {@code entity_registry} domain and are never
 * reassigned, even after the entity is deleted.
 */
@Singleton
public class EntityRegistry {
    private static final Logger log = Logger.getLogger(EntityRegistry.class);

    public static final String DOMAIN = "entity_registry";
    public static final Pattern ID_PATTERN = Pattern.compile("^(pc|npc|loc|item|faction)_([a-z0-9_]+)_(\\d{3})$");

    private static final int MAX_SEQUENCE = 999;

    public String register(StateStore store, EntityKind kind, String displayName) {
        return register(store, new EntityRegistration(kind, displayName));
    }

    public String register(StateStore store, EntityRegistration registration) {
        return registerAll(store, List.of(registration)).get(0);
    }

    /**
     * Register several entities in one commit. Returns the ids in request order.
     */
    public List<String> registerAll(StateStore store, List<EntityRegistration> registrations) {
        synchronized (store) {
            WorldState state = store.snapshot();
            Map<String, Object> registry = state.getMap(DOMAIN);
            Map<EntityKind, Integer> sequences = new HashMap<>();
            Map<String, EntityKind> pending = new LinkedHashMap<>();
            Patch.Builder patch = Patch.against(state);
            List<String> ids = new ArrayList<>();

            for (EntityRegistration r : registrations) {
                if (r.kind() == null) {
                    throw new IllegalArgumentException("Entity kind is required for " + r.displayName());
                }
                String id;
                if (r.existingId() != null) {
                    id = checkExistingId(r);
                    if (registry.containsKey(id) || pending.containsKey(id)) {
                        ids.add(id);
                        continue;
                    }
                } else {
                    int next = sequences.computeIfAbsent(r.kind(), k -> highestSequence(registry, k)) + 1;
                    if (next > MAX_SEQUENCE) {
                        throw new IllegalStateException("No %s ids left in campaign %s"
                                .formatted(r.kind().prefix(), store.campaignId()));
                    }
                    sequences.put(r.kind(), next);
                    id = "%s_%s_%03d".formatted(r.kind().prefix(), StringUtils.slugify(r.displayName()), next);
                }
                pending.put(id, r.kind());
                patch.set(StatePaths.join(DOMAIN, id), entry(r, state.version() + 1));
                ids.add(id);
            }

            if (!patch.isEmpty()) {
                store.apply(patch.build());
                log.infof("[%s] Registered %s", store.campaignId(), pending.keySet());
            }
            return ids;
        }
    }

    /**
     * Soft delete: the entry stays in the registry so the id is never reissued.
     */
    public void markDeleted(StateStore store, String id) {
        synchronized (store) {
            WorldState state = store.snapshot();
            RegisteredEntity entity = lookup(state, id)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown entity id: " + id));
            if (entity.deleted()) {
                return;
            }
            store.apply(Patch.against(state)
                    .set(StatePaths.join(DOMAIN, id) + ".deleted", true)
                    .set(StatePaths.join(DOMAIN, id) + ".deleted_version", state.version() + 1)
                    .build());
            log.infof("[%s] Marked %s deleted", store.campaignId(), id);
        }
    }

    public boolean isIssued(WorldState state, String id) {
        return id != null && state.getMap(DOMAIN).containsKey(id);
    }

    /**
     * True when {@code id} is well formed, issued, and not deleted.
     */
    public boolean validateReference(WorldState state, String id) {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            return false;
        }
        return lookup(state, id).map(e -> !e.deleted()).orElse(false);
    }

    public Optional<RegisteredEntity> lookup(WorldState state, String id) {
        Object entry = state.getMap(DOMAIN).get(id);
        if (entry instanceof Map<?, ?> map) {
            return Optional.of(RegisteredEntity.fromEntry(id, map));
        }
        return Optional.empty();
    }

    public List<RegisteredEntity> list(WorldState state, EntityKind kind) {
        List<RegisteredEntity> result = new ArrayList<>();
        for (String id : state.getMap(DOMAIN).keySet()) {
            lookup(state, id).filter(e -> e.kind() == kind).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Check every entity edge a patch would write against the registry.
     */
    public void validatePatch(WorldState state, Patch patch, PathSchema schema) {
        for (PatchOp op : patch.ops()) {
            if (op instanceof PatchOp.Assign assign) {
                List<String> segments = StatePaths.split(assign.path());
                for (int i = 1; i < segments.size(); i++) {
                    checkKey(state, schema, String.join(".", segments.subList(0, i)));
                }
                visit(state, schema, assign.path(), assign.value());
            }
        }
    }

    private void visit(WorldState state, PathSchema schema, String path, Object value) {
        checkKey(state, schema, path);
        Optional<ReferenceRule> rule = schema.referenceFor(path);
        if (rule.isPresent() && rule.get().mode() == ReferenceMode.VALUE && value instanceof String id
                && !validateReference(state, id)) {
            throw new UnregisteredEntityException(path, id);
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> visit(state, schema, StatePaths.join(path, String.valueOf(k)), v));
        }
    }

    private void checkKey(WorldState state, PathSchema schema, String path) {
        Optional<ReferenceRule> rule = schema.referenceFor(path);
        if (rule.isPresent() && rule.get().mode() == ReferenceMode.KEY) {
            String id = StatePaths.lastSegment(path);
            if (!validateReference(state, id)) {
                throw new UnregisteredEntityException(path, id);
            }
        }
    }

    private String checkExistingId(EntityRegistration r) {
        Matcher m = ID_PATTERN.matcher(r.existingId());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed entity id: " + r.existingId());
        }
        if (EntityKind.fromPrefix(m.group(1)) != r.kind()) {
            throw new IllegalArgumentException("Entity id %s is not a %s id".formatted(r.existingId(), r.kind()));
        }
        return r.existingId();
    }

    private static int highestSequence(Map<String, Object> registry, EntityKind kind) {
        int highest = 0;
        for (String id : registry.keySet()) {
            Matcher m = ID_PATTERN.matcher(id);
            if (m.matches() && m.group(1).equals(kind.prefix())) {
                highest = Math.max(highest, Integer.parseInt(m.group(3)));
            }
        }
        return highest;
    }

    private static Map<String, Object> entry(EntityRegistration r, long version) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("kind", r.kind().prefix());
        entry.put("display_name", StringUtils.firstNonBlank(r.displayName(), "unnamed"));
        entry.put("registered_version", version);
        entry.put("deleted", false);
        return entry;
    }
}
