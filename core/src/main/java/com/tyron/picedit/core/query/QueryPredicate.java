package com.tyron.picedit.core.query;

import com.tyron.picedit.api.tree.SyntaxNode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text condition checked against the source of a captured node once the structural part of
 * a pattern matched. Every node bound to the capture must satisfy it.
 */
public record QueryPredicate(Kind kind, String capture, List<String> values, Pattern regex) {

    public enum Kind {
        MATCH("match?"),
        NOT_MATCH("not-match?"),
        EQ("eq?"),
        NOT_EQ("not-eq?"),
        ANY_OF("any-of?");

        private final String id;

        Kind(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        public static Kind fromId(String id) {
            for (Kind k : values()) {
                if (k.id.equals(id)) {
                    return k;
                }
            }
            return null;
        }
    }

    public QueryPredicate {
        values = List.copyOf(values);
    }

    public boolean test(QueryMatch match) {
        List<SyntaxNode> nodes = match.nodes(capture);
        if (nodes.isEmpty()) {
            return false;
        }
        for (SyntaxNode node : nodes) {
            if (!test(node.text())) {
                return false;
            }
        }
        return true;
    }

    private boolean test(String text) {
        return switch (kind) {
            case MATCH -> regex.matcher(text).find();
            case NOT_MATCH -> !regex.matcher(text).find();
            case EQ -> values.get(0).equals(text);
            case NOT_EQ -> !values.get(0).equals(text);
            case ANY_OF -> values.contains(text);
        };
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(#%s @%s %s)", kind.id(), capture, values);
    }
}
