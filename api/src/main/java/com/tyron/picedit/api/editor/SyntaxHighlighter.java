package com.tyron.picedit.api.editor;

import com.tyron.picedit.api.tree.SyntaxTree;
import com.tyron.picedit.api.tree.TextRange;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Represents the generic capability to highlight a parsed document.
 */
public interface SyntaxHighlighter {

    /**
     * @return spans ordered by start offset for the whole tree.
     */
    default List<HighlightSpan> highlight(@NotNull SyntaxTree tree) {
        return highlight(tree, tree.root().range());
    }

    /**
     * @param range only spans intersecting this range are produced, clipped to it.
     */
    List<HighlightSpan> highlight(@NotNull SyntaxTree tree, @NotNull TextRange range);
}
