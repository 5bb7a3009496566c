package com.tyron.picedit.core.query;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.core.rules.NodeVocabulary;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches a {@link Query.Entry} against a candidate node: structure first, then the text
 * predicates over the captured nodes. A failing predicate rejects the whole match.
 */
final class QueryMatcher {

    private QueryMatcher() {
    }

    static @Nullable QueryMatch match(Query.Entry entry, int patternIndex, SyntaxNode node) {
        List<QueryCapture> captures = new ArrayList<>();
        if (!matches(entry.pattern(), node, captures)) {
            return null;
        }
        QueryMatch match = new QueryMatch(patternIndex, captures);
        for (QueryPredicate predicate : entry.predicates()) {
            if (!predicate.test(match)) {
                return null;
            }
        }
        return match;
    }

    /**
     * On failure {@code captures} is left as it was on entry.
     */
    static boolean matches(QueryPattern pattern, SyntaxNode node, List<QueryCapture> captures) {
        int mark = captures.size();
        for (String name : pattern.captures()) {
            captures.add(new QueryCapture(name, node));
        }

        boolean ok;
        if (pattern instanceof QueryPattern.NodePattern np) {
            ok = matchesNode(np, node, captures);
        } else if (pattern instanceof QueryPattern.LiteralPattern lp) {
            ok = !node.isNamed() && lp.literal().equals(node.type());
        } else if (pattern instanceof QueryPattern.AnyPattern) {
            ok = true;
        } else if (pattern instanceof QueryPattern.Alternation alt) {
            ok = false;
            for (QueryPattern alternative : alt.alternatives()) {
                if (matches(alternative, node, captures)) {
                    ok = true;
                    break;
                }
            }
        } else {
            ok = false;
        }

        if (!ok) {
            truncate(captures, mark);
        }
        return ok;
    }

    private static boolean matchesNode(QueryPattern.NodePattern pattern, SyntaxNode node, List<QueryCapture> captures) {
        String type = pattern.type();
        if (type == null) {
            if (!node.isNamed()) return false;
        } else if (NodeVocabulary.ERROR_TYPE.equals(type)) {
            if (!node.isError()) return false;
        } else if (!node.isNamed() || !type.equals(node.type())) {
            return false;
        }

        List<QueryPattern> sequence = new ArrayList<>();
        for (QueryPattern.Child child : pattern.children()) {
            if (child.field() == null) {
                sequence.add(child.pattern());
                continue;
            }
            SyntaxNode target = node.field(child.field());
            if (target == null || !matches(child.pattern(), target, captures)) {
                return false;
            }
        }
        return matchesSequence(sequence, 0, node, 0, captures);
    }

    /**
     * Unfielded child patterns must match an ordered, not necessarily contiguous,
     * subsequence of the children. Backtracks over the choice of child.
     */
    private static boolean matchesSequence(List<QueryPattern> sequence, int patternIndex,
                                           SyntaxNode parent, int childIndex, List<QueryCapture> captures) {
        if (patternIndex == sequence.size()) {
            return true;
        }
        QueryPattern pattern = sequence.get(patternIndex);
        int mark = captures.size();
        for (int i = childIndex; i < parent.childCount(); i++) {
            if (matches(pattern, parent.child(i), captures)
                    && matchesSequence(sequence, patternIndex + 1, parent, i + 1, captures)) {
                return true;
            }
            truncate(captures, mark);
        }
        return false;
    }

    private static void truncate(List<QueryCapture> captures, int size) {
        while (captures.size() > size) {
            captures.remove(captures.size() - 1);
        }
    }
}
