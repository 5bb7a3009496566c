package com.tyron.picedit.api.tree;

import org.jetbrains.annotations.NotNull;

/**
 * An immutable snapshot of a parsed document.
 */
public interface SyntaxTree {

    @NotNull SyntaxNode root();

    /**
     * @return the source text the tree was parsed from.
     */
    @NotNull CharSequence text();

    /**
     * Incremented by the parser on every re-parse of the same document. Results computed
     * against one generation are stale once the generation changes.
     */
    long generation();
}
