package com.tyron.picedit.core.indent;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.api.tree.SyntaxNodes;
import com.tyron.picedit.api.tree.SyntaxTree;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * What an indentation rule looks at: the node starting the line (null on a blank line),
 * its parent and the tree they belong to.
 */
public record IndentContext(@Nullable SyntaxNode node, @Nullable SyntaxNode parent, @NotNull SyntaxTree tree) {

    public IndentContext {
        Objects.requireNonNull(tree, "tree");
    }

    public static IndentContext of(@NotNull SyntaxNode node) {
        return new IndentContext(node, node.parent(), node.tree());
    }

    public @Nullable SyntaxNode grandparent() {
        return parent == null ? null : parent.parent();
    }

    /**
     * @return the field under which {@link #node()} hangs from its parent, or null.
     */
    public @Nullable String fieldName() {
        if (node == null || parent == null) {
            return null;
        }
        int index = SyntaxNodes.indexInParent(node);
        return index < 0 ? null : parent.fieldNameOfChild(index);
    }

    public @Nullable SyntaxNode previousSibling() {
        return node == null ? null : node.previousSibling();
    }
}
