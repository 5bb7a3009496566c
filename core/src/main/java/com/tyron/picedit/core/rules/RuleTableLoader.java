package com.tyron.picedit.core.rules;

import com.tyron.picedit.core.highlight.HighlightLevels;
import com.tyron.picedit.core.highlight.HighlightRuleTable;
import com.tyron.picedit.core.indent.IndentAnchor;
import com.tyron.picedit.core.indent.IndentCondition;
import com.tyron.picedit.core.indent.IndentRule;
import com.tyron.picedit.core.indent.IndentRuleTable;
import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads highlight and indentation rule tables from YAML documents.
 *
 * <pre>
 * highlight:
 *   - feature: comment
 *     level: 1
 *     override: false          # optional, default false
 *     queries:
 *       - "(comment) @comment"
 *
 * indent:
 *   - name: closing-bracket
 *     when:                    # optional; omitted means catch-all
 *       node: ["}", "]"]
 *       "!parent": [program]   # a leading '!' negates the condition
 *     anchor: grandparent      # column-0 | grandparent | parent | parent-bol
 *     indent: 0                # multiples of the indentation unit, optional
 *     columns: 0               # extra columns, optional, may be negative
 * </pre>
 *
 * Every defect is reported as a {@link RuleTableException} naming the offending entry.
 */
public final class RuleTableLoader {

    private static final Logger LOG = Logger.getLogger(RuleTableLoader.class.getName());

    private final NodeVocabulary vocabulary;

    public RuleTableLoader(@NotNull NodeVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
    }

    public HighlightRuleTable loadHighlightRules(@NotNull InputStream in) throws IOException {
        List<?> entries = section(read(in), "highlight");
        HighlightRuleTable.Builder builder = HighlightRuleTable.builder(vocabulary);
        for (int i = 0; i < entries.size(); i++) {
            Map<?, ?> entry = entry(entries.get(i), "highlight", i);
            String where = "highlight[" + i + "]";

            String feature = requireString(entry, "feature", where);
            where = "highlight feature '" + feature + "'";
            int level = requireInt(entry, "level", where);
            if (level < HighlightLevels.MIN_LEVEL || level > HighlightLevels.MAX_LEVEL) {
                throw new RuleTableException(where + ": level " + level + " outside ["
                        + HighlightLevels.MIN_LEVEL + ", " + HighlightLevels.MAX_LEVEL + "]");
            }
            boolean override = optionalBoolean(entry, "override", false, where);
            List<String> queries = requireStrings(entry, "queries", where);

            builder.feature(feature, level, override, queries);
        }
        HighlightRuleTable table = builder.build();
        if (LOG.isLoggable(Level.INFO)) {
            LOG.info("Loaded highlight table: " + table.getFeatures().size() + " features, "
                    + table.getRules().size() + " rules");
        }
        return table;
    }

    public IndentRuleTable loadIndentRules(@NotNull InputStream in) throws IOException {
        List<?> entries = section(read(in), "indent");
        List<IndentRule> rules = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Map<?, ?> entry = entry(entries.get(i), "indent", i);
            String where = "indent[" + i + "]";

            String name = entry.containsKey("name") ? requireString(entry, "name", where) : "rule-" + i;
            where = "indent rule '" + name + "'";

            String anchorId = requireString(entry, "anchor", where);
            IndentAnchor anchor = IndentAnchor.fromId(anchorId);
            if (anchor == null) {
                throw new RuleTableException(where + ": unknown anchor '" + anchorId + "'");
            }
            int units = optionalInt(entry, "indent", 0, where);
            int columns = optionalInt(entry, "columns", 0, where);

            rules.add(new IndentRule(name, conditions(entry.get("when"), where), anchor, units, columns));
        }
        IndentRuleTable table = IndentRuleTable.of(rules, vocabulary);
        if (LOG.isLoggable(Level.INFO)) {
            LOG.info("Loaded indentation table: " + rules.size() + " rules");
        }
        return table;
    }

    private static List<IndentCondition> conditions(Object when, String where) {
        if (when == null) {
            return List.of();
        }
        if (!(when instanceof Map<?, ?> map)) {
            throw new RuleTableException(where + ": 'when' must be a mapping");
        }
        List<IndentCondition> out = new ArrayList<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            boolean negated = key.startsWith("!");
            String id = negated ? key.substring(1) : key;
            IndentCondition.Kind kind = IndentCondition.Kind.fromId(id);
            if (kind == null) {
                throw new RuleTableException(where + ": unknown condition '" + key + "'");
            }
            out.add(new IndentCondition(kind, values(e.getValue(), where, key), negated));
        }
        return out;
    }

    private static Set<String> values(Object raw, String where, String key) {
        Set<String> out = new LinkedHashSet<>();
        if (raw == null || raw instanceof Boolean) {
            // "no-node: true" / "catch-all: true"
            return out;
        }
        if (raw instanceof List<?> list) {
            for (Object o : list) {
                out.add(String.valueOf(o));
            }
        } else if (raw instanceof String || raw instanceof Number) {
            out.add(String.valueOf(raw));
        } else {
            throw new RuleTableException(where + ": condition '" + key + "' must be a string or a list");
        }
        return out;
    }

    private static Map<?, ?> read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        Object doc;
        try (in) {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new RuleTableException("Malformed rule table: " + e.getMessage(), e);
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new RuleTableException("Rule table must be a mapping at top level");
        }
        return map;
    }

    private static List<?> section(Map<?, ?> doc, String key) {
        Object value = doc.get(key);
        if (!(value instanceof List<?> list)) {
            throw new RuleTableException("Rule table has no '" + key + "' list");
        }
        return list;
    }

    private static Map<?, ?> entry(Object raw, String section, int index) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new RuleTableException(section + "[" + index + "] must be a mapping");
        }
        return map;
    }

    private static String requireString(Map<?, ?> entry, String key, String where) {
        Object value = entry.get(key);
        if (!(value instanceof String s) || s.isBlank()) {
            throw new RuleTableException(where + ": '" + key + "' must be a non-empty string");
        }
        return s;
    }

    private static int requireInt(Map<?, ?> entry, String key, String where) {
        Object value = entry.get(key);
        if (!(value instanceof Integer i)) {
            throw new RuleTableException(where + ": '" + key + "' must be an integer");
        }
        return i;
    }

    private static int optionalInt(Map<?, ?> entry, String key, int fallback, String where) {
        return entry.containsKey(key) ? requireInt(entry, key, where) : fallback;
    }

    private static boolean optionalBoolean(Map<?, ?> entry, String key, boolean fallback, String where) {
        Object value = entry.get(key);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Boolean b)) {
            throw new RuleTableException(where + ": '" + key + "' must be true or false");
        }
        return b;
    }

    private static List<String> requireStrings(Map<?, ?> entry, String key, String where) {
        Object value = entry.get(key);
        if (value instanceof String s) {
            return List.of(s);
        }
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            throw new RuleTableException(where + ": '" + key + "' must be a non-empty list");
        }
        List<String> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (!(o instanceof String s)) {
                throw new RuleTableException(where + ": every entry of '" + key + "' must be a string");
            }
            out.add(s);
        }
        return out;
    }
}
