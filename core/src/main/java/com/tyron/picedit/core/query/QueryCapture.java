package com.tyron.picedit.core.query;

import com.tyron.picedit.api.tree.SyntaxNode;

/**
 * A node bound to a capture name by a successful match.
 */
public record QueryCapture(String name, SyntaxNode node) {

    /**
     * Captures whose name starts with an underscore only feed predicates.
     */
    public boolean isInternal() {
        return name.startsWith("_");
    }
}
