package com.tyron.picedit.core.indent;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.api.tree.SyntaxNodes;
import org.jetbrains.annotations.Nullable;

/**
 * Where the indentation offset of a rule is measured from.
 */
public enum IndentAnchor {

    /**
     * Column zero; the result is the offset alone.
     */
    COLUMN_ZERO("column-0"),

    /**
     * The start column of the grandparent node.
     */
    GRANDPARENT("grandparent"),

    /**
     * The start column of the parent node.
     */
    PARENT("parent"),

    /**
     * The indentation of the line on which the parent starts. Differs from {@link #PARENT}
     * when the parent is not the first thing on its line.
     */
    PARENT_BOL("parent-bol");

    private final String id;

    IndentAnchor(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static @Nullable IndentAnchor fromId(String id) {
        for (IndentAnchor a : values()) {
            if (a.id.equals(id)) {
                return a;
            }
        }
        return null;
    }

    /**
     * @return the anchor column; zero when the anchor node does not exist.
     */
    int column(IndentContext context, int tabWidth) {
        CharSequence text = context.tree().text();
        return switch (this) {
            case COLUMN_ZERO -> 0;
            case GRANDPARENT -> startColumn(text, context.grandparent(), tabWidth);
            case PARENT -> startColumn(text, context.parent(), tabWidth);
            case PARENT_BOL -> {
                SyntaxNode parent = context.parent();
                yield parent == null ? 0 : SyntaxNodes.indentationOfLine(text, parent.startOffset(), tabWidth);
            }
        };
    }

    private static int startColumn(CharSequence text, @Nullable SyntaxNode node, int tabWidth) {
        return node == null ? 0 : SyntaxNodes.column(text, node.startOffset(), tabWidth);
    }
}
