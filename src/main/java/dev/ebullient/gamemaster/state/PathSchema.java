package dev.ebullient.gamemaster.state;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Per-path schema table for the world state tree: recognised domains, typed paths,
 * and entity reference (edge) paths. Patterns use {@code *} to match exactly one segment.
 */
public final class PathSchema {

    public static final String DEFAULT_RESOURCE = "schema/world-state.yaml";

    public enum FieldType {
        @JsonProperty("list")
        LIST,
        @JsonProperty("object")
        OBJECT,
        @JsonProperty("string")
        STRING,
        @JsonProperty("integer")
        INTEGER,
        @JsonProperty("number")
        NUMBER,
        @JsonProperty("boolean")
        BOOLEAN;

        public String label() {
            return name().toLowerCase();
        }
    }

    public enum ReferenceMode {
        /** the last path segment (a map key) is an entity id */
        @JsonProperty("key")
        KEY,
        /** the string value stored at the path is an entity id */
        @JsonProperty("value")
        VALUE
    }

    public record FieldRule(
            String path,
            FieldType type,
            Long min,
            Long max,
            boolean unique,
            @JsonProperty("legacy-status") boolean legacyStatus,
            List<String> values,
            List<String> keys,
            @JsonProperty("at-most") String atMost,
            @JsonProperty("engine-managed") boolean engineManaged) {

        /**
         * Reject {@code value} if it does not satisfy this rule.
         */
        public void check(String concretePath, Object value) {
            boolean ok = switch (type) {
                case LIST -> value instanceof List;
                case OBJECT -> value instanceof Map;
                case STRING -> value instanceof String;
                case INTEGER -> StateTrees.isIntegral(value);
                case NUMBER -> value instanceof Number;
                case BOOLEAN -> value instanceof Boolean;
            };
            if (!ok) {
                throw new SchemaViolationException(concretePath, type.label(), StateTrees.describe(value));
            }
            if (type == FieldType.INTEGER) {
                long n = ((Number) value).longValue();
                if ((min != null && n < min) || (max != null && n > max)) {
                    throw new SchemaViolationException(concretePath,
                            "integer in [%s, %s]".formatted(min == null ? "-inf" : min, max == null ? "+inf" : max),
                            Long.toString(n));
                }
            }
            if (values != null && !values.contains(value)) {
                throw new SchemaViolationException(concretePath, "one of " + values, String.valueOf(value));
            }
            if (keys != null && !keys.contains(StatePaths.lastSegment(concretePath))) {
                throw new SchemaViolationException(concretePath, "key in " + keys,
                        StatePaths.lastSegment(concretePath));
            }
        }
    }

    public record ReferenceRule(String path, ReferenceMode mode) {
    }

    public record SchemaDocument(List<String> domains, List<FieldRule> paths, List<ReferenceRule> references) {
    }

    private final Set<String> domains;
    private final List<FieldRule> rules;
    private final List<ReferenceRule> references;

    public PathSchema(Set<String> domains, List<FieldRule> rules, List<ReferenceRule> references) {
        this.domains = Set.copyOf(new LinkedHashSet<>(domains));
        // most specific first: fewer wildcards wins
        this.rules = rules.stream()
                .sorted(Comparator.comparingLong(r -> wildcards(r.path())))
                .toList();
        this.references = List.copyOf(references);
    }

    public static PathSchema fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static PathSchema fromClasspath(String resource) {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found on classpath");
            }
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema " + resource, e);
        }
    }

    /**
     * Parse YAML via SnakeYAML, then convert through Jackson for typed records.
     */
    public static PathSchema load(InputStream yamlInput) {
        Object raw = new Yaml(new LoaderOptions()).load(yamlInput);
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        SchemaDocument doc = mapper.convertValue(raw, SchemaDocument.class);
        if (doc == null || doc.domains() == null || doc.domains().isEmpty()) {
            throw new IllegalStateException("World state schema declares no domains");
        }
        return new PathSchema(new LinkedHashSet<>(doc.domains()),
                doc.paths() == null ? List.of() : doc.paths(),
                doc.references() == null ? List.of() : doc.references());
    }

    public List<String> domains() {
        return domains.stream().sorted().toList();
    }

    public boolean isDomain(String key) {
        return domains.contains(key);
    }

    public Optional<FieldRule> ruleFor(String path) {
        List<String> segments = StatePaths.split(path);
        return rules.stream()
                .filter(r -> matches(r.path(), segments))
                .findFirst();
    }

    public List<FieldRule> rules() {
        return rules;
    }

    /**
     * The engine-managed rule at {@code path} or below it. Author patches may not
     * replace, append to or delete such a path, nor any object that contains one.
     */
    public Optional<FieldRule> engineManagedWithin(String path) {
        List<String> segments = StatePaths.split(path);
        return rules.stream()
                .filter(FieldRule::engineManaged)
                .filter(r -> prefixMatches(r.path(), segments))
                .findFirst();
    }

    public List<ReferenceRule> references() {
        return references;
    }

    public Optional<ReferenceRule> referenceFor(String path) {
        List<String> segments = StatePaths.split(path);
        return references.stream()
                .filter(r -> matches(r.path(), segments))
                .findFirst();
    }

    static boolean matches(String pattern, List<String> segments) {
        String[] parts = pattern.split("\\.");
        if (parts.length != segments.size()) {
            return false;
        }
        for (int i = 0; i < parts.length; i++) {
            if (!parts[i].equals("*") && !parts[i].equals(segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean prefixMatches(String pattern, List<String> segments) {
        String[] parts = pattern.split("\\.");
        if (parts.length < segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            if (!parts[i].equals("*") && !parts[i].equals(segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static long wildcards(String pattern) {
        return pattern.chars().filter(c -> c == '*').count();
    }
}
