package com.tyron.picedit.api.editor;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.api.tree.SyntaxTree;
import org.jetbrains.annotations.NotNull;

/**
 * Computes the indentation column of a line from its syntactic context.
 */
public interface Indenter {

    /**
     * @param node the node that starts the line.
     * @return a non-negative column.
     */
    int indentOf(@NotNull SyntaxNode node);

    /**
     * Indentation for the line containing {@code offset}, which may be blank.
     */
    int indentAt(@NotNull SyntaxTree tree, int offset);
}
