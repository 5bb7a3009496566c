package com.tyron.picedit.core.query;

import com.tyron.picedit.api.tree.SyntaxNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of matching one pattern of a {@link Query} at a node.
 *
 * @param patternIndex index of the matching pattern within its query
 * @param captures     captured nodes in the order the pattern binds them
 */
public record QueryMatch(int patternIndex, List<QueryCapture> captures) {

    public QueryMatch {
        captures = List.copyOf(captures);
    }

    /**
     * @return the first node bound to {@code name}, or null.
     */
    public @Nullable SyntaxNode node(String name) {
        for (QueryCapture c : captures) {
            if (c.name().equals(name)) {
                return c.node();
            }
        }
        return null;
    }

    public List<SyntaxNode> nodes(String name) {
        List<SyntaxNode> out = new ArrayList<>();
        for (QueryCapture c : captures) {
            if (c.name().equals(name)) {
                out.add(c.node());
            }
        }
        return out;
    }

    /**
     * @return capture name to first bound node.
     */
    public Map<String, SyntaxNode> asMap() {
        Map<String, SyntaxNode> out = new LinkedHashMap<>();
        for (QueryCapture c : captures) {
            out.putIfAbsent(c.name(), c.node());
        }
        return out;
    }
}
