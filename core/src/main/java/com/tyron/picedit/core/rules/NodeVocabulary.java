package com.tyron.picedit.core.rules;

import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The node types and field names a grammar can produce. Rule tables are validated against
 * it so that a typo in a pattern fails when the table is loaded.
 * <p>
 * {@code ERROR} is always a known named type.
 */
public final class NodeVocabulary {

    public static final String ERROR_TYPE = "ERROR";

    private static final NodeVocabulary PERMISSIVE = new NodeVocabulary(Set.of(), Set.of(), Set.of(), true);

    private final Set<String> namedTypes;
    private final Set<String> tokens;
    private final Set<String> fields;
    private final boolean permissive;

    private NodeVocabulary(Set<String> namedTypes, Set<String> tokens, Set<String> fields, boolean permissive) {
        this.namedTypes = namedTypes;
        this.tokens = tokens;
        this.fields = fields;
        this.permissive = permissive;
    }

    public static NodeVocabulary of(Collection<String> namedTypes, Collection<String> tokens, Collection<String> fields) {
        Set<String> named = new LinkedHashSet<>(namedTypes);
        named.add(ERROR_TYPE);
        return new NodeVocabulary(Set.copyOf(named), Set.copyOf(tokens), Set.copyOf(fields), false);
    }

    /**
     * A vocabulary that accepts every type and field.
     */
    public static NodeVocabulary permissive() {
        return PERMISSIVE;
    }

    /**
     * Reads a vocabulary document:
     * <pre>
     * named: [program, comment, ...]
     * tokens: ["{", "}", if, ...]
     * fields: [lhs, rhs, ...]
     * </pre>
     */
    public static NodeVocabulary load(@NotNull InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        Object doc;
        try (in) {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new RuleTableException("Malformed node vocabulary: " + e.getMessage(), e);
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new RuleTableException("Node vocabulary must be a mapping");
        }
        return of(strings(map, "named"), strings(map, "tokens"), strings(map, "fields"));
    }

    private static List<String> strings(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new RuleTableException("Node vocabulary key '" + key + "' must be a list");
        }
        return list.stream().map(String::valueOf).toList();
    }

    public boolean isNamedType(String type) {
        return permissive || namedTypes.contains(type);
    }

    public boolean isToken(String literal) {
        return permissive || tokens.contains(literal);
    }

    public boolean isType(String type) {
        return isNamedType(type) || isToken(type);
    }

    public boolean isField(String field) {
        return permissive || fields.contains(field);
    }

    public boolean isPermissive() {
        return permissive;
    }
}
