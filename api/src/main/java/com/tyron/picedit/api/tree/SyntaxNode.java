package com.tyron.picedit.api.tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Read-only view of a node in a concrete syntax tree produced by an external parser.
 * <p>
 * A node reference is only valid while its {@link #tree()} is the current parse of the
 * document. Parse errors are ordinary nodes with {@link #isError()} set; none of these
 * methods throw for a tree that contains them.
 */
public interface SyntaxNode {

    /**
     * @return the grammar type of this node, e.g. {@code "string"}, or the literal text of
     * an anonymous token such as {@code "{"} or {@code "if"}.
     */
    @NotNull String type();

    /**
     * Named nodes come from grammar rules, anonymous nodes are literal tokens.
     */
    boolean isNamed();

    /**
     * @return true for nodes produced by the parser's error recovery.
     */
    boolean isError();

    int startOffset();

    int endOffset();

    default TextRange range() {
        return new TextRange(startOffset(), endOffset());
    }

    @Nullable SyntaxNode parent();

    /**
     * @return children in source order.
     */
    @NotNull List<? extends SyntaxNode> children();

    default int childCount() {
        return children().size();
    }

    default SyntaxNode child(int index) {
        return children().get(index);
    }

    /**
     * @return the field name under which the child at {@code index} is attached, or null.
     */
    @Nullable String fieldNameOfChild(int index);

    /**
     * @return the first child attached under the given field, or null.
     */
    default @Nullable SyntaxNode field(@NotNull String name) {
        for (int i = 0; i < childCount(); i++) {
            if (name.equals(fieldNameOfChild(i))) {
                return child(i);
            }
        }
        return null;
    }

    @Nullable SyntaxNode previousSibling();

    @Nullable SyntaxNode nextSibling();

    @NotNull SyntaxTree tree();

    /**
     * @return the source text covered by this node.
     */
    default @NotNull String text() {
        return tree().text().subSequence(startOffset(), endOffset()).toString();
    }
}
