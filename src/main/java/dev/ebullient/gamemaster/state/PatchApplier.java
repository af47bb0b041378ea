package dev.ebullient.gamemaster.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jboss.logging.Logger;

import dev.ebullient.gamemaster.state.PathSchema.FieldRule;
import dev.ebullient.gamemaster.state.PathSchema.FieldType;

/**
 * Pure patch application: {@code apply(current, ops) -> next tree}.
 * Works on a private mutable copy, so a rejected op leaves {@code current} untouched.
 */
public class PatchApplier {
    private static final Logger log = Logger.getLogger(PatchApplier.class);

    private final PathSchema schema;

    public PatchApplier(PathSchema schema) {
        this.schema = schema;
    }

    public Map<String, Object> apply(Map<String, Object> current, List<PatchOp> ops) {
        return apply(current, ops, PatchSource.ENGINE);
    }

    /**
     * Apply {@code ops} on behalf of {@code source}. Author patches may not write
     * engine-managed paths; every other source may.
     */
    public Map<String, Object> apply(Map<String, Object> current, List<PatchOp> ops, PatchSource source) {
        Application application = new Application(StateTrees.mutableCopyOf(current), source);
        for (PatchOp op : ops) {
            application.applyOp(op);
        }
        application.checkBounds();
        return application.root;
    }

    private class Application {
        final Map<String, Object> root;
        final PatchSource source;
        final Set<String> touched = new LinkedHashSet<>();

        Application(Map<String, Object> root, PatchSource source) {
            this.root = root;
            this.source = source;
        }

        void applyOp(PatchOp op) {
            List<String> segments = StatePaths.split(op.path());
            String domain = segments.get(0);
            if (WorldState.VERSION_KEY.equals(domain)) {
                throw new SchemaViolationException(domain, "store-managed version", "patch value");
            }
            if (!schema.isDomain(domain)) {
                throw new UnknownDomainException(domain);
            }

            if (segments.size() == 1) {
                applyToDomain(domain, op);
                return;
            }
            boolean recurses = op instanceof PatchOp.Assign assign && assign.value() instanceof Map;
            if (!recurses) {
                requireAuthorWritable(op);
            }

            Map<String, Object> parent = parentOf(segments, !(op instanceof PatchOp.Delete));
            String key = segments.get(segments.size() - 1);

            if (op instanceof PatchOp.Delete) {
                if (parent != null && parent.remove(key) != null) {
                    log.debugf("Deleted %s", op.path());
                }
            } else if (op instanceof PatchOp.Append append) {
                appendItems(parent, append.path(), key, append.items());
                touched.add(append.path());
            } else if (op instanceof PatchOp.Assign assign) {
                assign(parent, assign.path(), key, assign.value());
            }
        }

        private void requireAuthorWritable(PatchOp op) {
            if (source != PatchSource.AUTHOR) {
                return;
            }
            schema.engineManagedWithin(op.path()).ifPresent(rule -> {
                throw new SchemaViolationException(op.path(), "engine-managed " + rule.path(), "author write");
            });
        }

        private void applyToDomain(String domain, PatchOp op) {
            if (op instanceof PatchOp.Assign assign && assign.value() instanceof Map<?, ?> values) {
                if (!(root.get(domain) instanceof Map)) {
                    root.put(domain, new LinkedHashMap<String, Object>());
                }
                for (PatchOp nested : PatchParser.flatten(domain, values)) {
                    applyOp(nested);
                }
                return;
            }
            String attempted = op instanceof PatchOp.Assign assign
                    ? StateTrees.describe(assign.value())
                    : op instanceof PatchOp.Delete ? "domain delete" : "append";
            throw new SchemaViolationException(domain, "merge into object domain", attempted);
        }

        /**
         * Walk to the parent map of the final segment, creating intermediate objects when {@code create} is set.
         * Returns null when not creating and the parent does not exist.
         */
        private Map<String, Object> parentOf(List<String> segments, boolean create) {
            Map<String, Object> current = root;
            String prefix = "";
            for (int i = 0; i < segments.size() - 1; i++) {
                String segment = segments.get(i);
                prefix = StatePaths.join(prefix, segment);
                Optional<FieldRule> rule = i == 0 ? Optional.empty() : schema.ruleFor(prefix);
                if (rule.isPresent() && rule.get().type() != FieldType.OBJECT) {
                    throw new SchemaViolationException(prefix, rule.get().type().label(), "object");
                }
                Object next = current.get(segment);
                if (next == null) {
                    if (!create) {
                        return null;
                    }
                    Map<String, Object> created = new LinkedHashMap<>();
                    current.put(segment, created);
                    current = created;
                } else if (next instanceof Map<?, ?> map) {
                    Map<String, Object> owned = StateTrees.keyed(map);
                    current.put(segment, owned);
                    current = owned;
                } else {
                    throw new SchemaViolationException(prefix, "object", StateTrees.describe(next));
                }
            }
            return current;
        }

        private void appendItems(Map<String, Object> parent, String path, String key, List<Object> items) {
            Optional<FieldRule> rule = schema.ruleFor(path);
            if (rule.isPresent() && rule.get().type() != FieldType.LIST) {
                throw new SchemaViolationException(path, rule.get().type().label(), "append");
            }
            Object existing = parent.get(key);
            List<Object> target = new ArrayList<>();
            if (existing instanceof List<?> list) {
                target.addAll(list);
            } else if (existing != null) {
                throw new SchemaViolationException(path, "list", StateTrees.describe(existing));
            }
            boolean unique = rule.map(FieldRule::unique).orElse(false);
            int added = 0;
            for (Object item : items) {
                Object copy = StateTrees.mutableCopy(item);
                if (unique && target.contains(copy)) {
                    continue;
                }
                target.add(copy);
                added++;
            }
            parent.put(key, target);
            log.debugf("Appended %d of %d item(s) to %s", added, items.size(), path);
        }

        private void assign(Map<String, Object> parent, String path, String key, Object value) {
            Optional<FieldRule> rule = schema.ruleFor(path);

            if (value instanceof Map<?, ?> values) {
                if (rule.isPresent() && rule.get().type() != FieldType.OBJECT) {
                    throw new SchemaViolationException(path, rule.get().type().label(), "object");
                }
                if (!(parent.get(key) instanceof Map)) {
                    parent.put(key, new LinkedHashMap<String, Object>());
                }
                for (PatchOp nested : PatchParser.flatten(path, values)) {
                    applyOp(nested);
                }
                return;
            }

            if (value instanceof String status && rule.map(FieldRule::legacyStatus).orElse(false)) {
                Map<String, Object> entry = parent.get(key) instanceof Map<?, ?> existing
                        ? StateTrees.keyed(existing)
                        : new LinkedHashMap<>();
                entry.put("status", status);
                parent.put(key, entry);
                log.warnf("Legacy string update at %s wrapped as {\"status\": \"%s\"}", path, status);
                return;
            }

            rule.ifPresent(r -> r.check(path, value));
            parent.put(key, StateTrees.mutableCopy(value));
            touched.add(path);
        }

        /**
         * Cross-field bounds ({@code at-most}) are checked once the whole patch is applied,
         * so a patch may raise a limit and the bounded value together.
         */
        void checkBounds() {
            Set<String> candidates = new LinkedHashSet<>();
            for (String path : touched) {
                candidates.add(path);
                for (FieldRule rule : schema.rules()) {
                    if (rule.atMost() != null && rule.atMost().equals(StatePaths.lastSegment(path))) {
                        candidates.add(StatePaths.join(StatePaths.parentOf(path), StatePaths.lastSegment(rule.path())));
                    }
                }
            }
            for (String path : candidates) {
                Optional<FieldRule> rule = schema.ruleFor(path);
                if (rule.isEmpty() || rule.get().atMost() == null) {
                    continue;
                }
                String limitPath = StatePaths.join(StatePaths.parentOf(path), rule.get().atMost());
                if (valueAt(path) instanceof Number value && valueAt(limitPath) instanceof Number limit
                        && value.longValue() > limit.longValue()) {
                    throw new SchemaViolationException(path, "at most " + limitPath + " (" + limit + ")",
                            value.toString());
                }
            }
        }

        private Object valueAt(String path) {
            Object current = root;
            for (String segment : StatePaths.split(path)) {
                if (!(current instanceof Map<?, ?> map)) {
                    return null;
                }
                current = map.get(segment);
            }
            return current;
        }
    }
}
