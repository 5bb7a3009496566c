package com.tyron.picedit.core.query;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.core.rules.NodeVocabulary;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled query: one or more top-level patterns, each with its text predicates.
 * <p>
 * Queries are written in tree-sitter query notation, e.g.
 * <pre>{@code
 * ((call function: (identifier) @builtin) (#match? @builtin "^(sin|cos)$"))
 * }</pre>
 * Instances are immutable and may be shared between threads.
 */
public final class Query {

    /**
     * A top-level pattern and the predicates that must hold for its captures.
     */
    public record Entry(QueryPattern pattern, List<QueryPredicate> predicates) {

        public Entry {
            predicates = List.copyOf(predicates);
        }
    }

    private final String source;
    private final List<Entry> entries;
    private final Set<String> captureNames;

    Query(String source, List<Entry> entries) {
        this.source = source;
        this.entries = List.copyOf(entries);
        Set<String> names = new LinkedHashSet<>();
        for (Entry e : entries) {
            collectCaptures(e.pattern(), names);
        }
        this.captureNames = Set.copyOf(names);
    }

    public static Query compile(@NotNull String source, @NotNull NodeVocabulary vocabulary) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(vocabulary, "vocabulary");
        return new QueryParser(source, vocabulary).parse();
    }

    public static Query compile(@NotNull String source) {
        return compile(source, NodeVocabulary.permissive());
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public Set<String> getCaptureNames() {
        return captureNames;
    }

    /**
     * Matches every pattern with {@code node} as the pattern root.
     *
     * @return the successful matches, in pattern order; empty if none
     */
    public List<QueryMatch> matchAt(@NotNull SyntaxNode node) {
        List<QueryMatch> out = null;
        for (int i = 0; i < entries.size(); i++) {
            QueryMatch m = QueryMatcher.match(entries.get(i), i, node);
            if (m != null) {
                if (out == null) out = new ArrayList<>(2);
                out.add(m);
            }
        }
        return out == null ? List.of() : out;
    }

    static void collectCaptures(QueryPattern pattern, Set<String> out) {
        out.addAll(pattern.captures());
        if (pattern instanceof QueryPattern.NodePattern node) {
            for (QueryPattern.Child child : node.children()) {
                collectCaptures(child.pattern(), out);
            }
        } else if (pattern instanceof QueryPattern.Alternation alt) {
            for (QueryPattern a : alt.alternatives()) {
                collectCaptures(a, out);
            }
        }
    }

    @Override
    public String toString() {
        return source;
    }
}
