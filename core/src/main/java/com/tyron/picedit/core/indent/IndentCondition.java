package com.tyron.picedit.core.indent;

import com.tyron.picedit.api.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Set;

/**
 * One test of an {@link IndentRule}, as data: a kind plus the values it compares against.
 */
public record IndentCondition(Kind kind, Set<String> values, boolean negated) {

    public enum Kind {
        /** the node's type is one of the values */
        NODE_IS("node"),
        /** the node's source text is one of the values, e.g. a closing bracket */
        NODE_TEXT_IS("node-text"),
        PARENT_IS("parent"),
        GRANDPARENT_IS("grandparent"),
        PREV_SIBLING_IS("prev-sibling"),
        /** the node hangs from its parent under one of the field names */
        FIELD_IS("field"),
        /** the line is blank */
        NO_NODE("no-node"),
        CATCH_ALL("catch-all");

        private final String id;

        Kind(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        public static @Nullable Kind fromId(String id) {
            for (Kind k : values()) {
                if (k.id.equals(id)) {
                    return k;
                }
            }
            return null;
        }

        boolean takesValues() {
            return this != NO_NODE && this != CATCH_ALL;
        }
    }

    public IndentCondition {
        Objects.requireNonNull(kind, "kind");
        values = Set.copyOf(values);
    }

    public static IndentCondition of(Kind kind, String... values) {
        return new IndentCondition(kind, Set.of(values), false);
    }

    public static IndentCondition not(Kind kind, String... values) {
        return new IndentCondition(kind, Set.of(values), true);
    }

    public static IndentCondition catchAll() {
        return new IndentCondition(Kind.CATCH_ALL, Set.of(), false);
    }

    public boolean test(IndentContext context) {
        boolean result = switch (kind) {
            case NODE_IS -> typeIn(context.node());
            case NODE_TEXT_IS -> context.node() != null && values.contains(context.node().text());
            case PARENT_IS -> typeIn(context.parent());
            case GRANDPARENT_IS -> typeIn(context.grandparent());
            case PREV_SIBLING_IS -> typeIn(context.previousSibling());
            case FIELD_IS -> context.fieldName() != null && values.contains(context.fieldName());
            case NO_NODE -> context.node() == null;
            case CATCH_ALL -> true;
        };
        return negated != result;
    }

    private boolean typeIn(@Nullable SyntaxNode node) {
        return node != null && values.contains(node.type());
    }

    @Override
    public String toString() {
        return (negated ? "!" : "") + kind.id() + (values.isEmpty() ? "" : " " + values);
    }
}
