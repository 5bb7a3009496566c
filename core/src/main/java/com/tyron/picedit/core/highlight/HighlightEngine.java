package com.tyron.picedit.core.highlight;

import com.tyron.picedit.api.editor.HighlightSpan;
import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.api.tree.TextRange;
import com.tyron.picedit.core.query.QueryCapture;
import com.tyron.picedit.core.query.QueryMatch;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a syntax tree into highlight spans using a {@link HighlightRuleTable}.
 * <p>
 * The tree is walked once, depth-first. Every active rule is tried at every node and its
 * matches are collected; painting then happens rule by rule in table order so that
 * precedence only depends on the table:
 * <ul>
 *     <li>a non-override rule fills the characters no earlier rule painted,</li>
 *     <li>an override rule repaints its whole capture,</li>
 *     <li>the error feature is painted last, whatever levels are enabled.</li>
 * </ul>
 * The engine keeps no state between calls and may be shared between threads.
 */
public final class HighlightEngine {

    private static final Logger LOG = Logger.getLogger(HighlightEngine.class.getName());

    private final HighlightRuleTable table;

    public HighlightEngine(@NotNull HighlightRuleTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public HighlightRuleTable getTable() {
        return table;
    }

    public List<HighlightSpan> highlight(@NotNull SyntaxNode root, @NotNull Collection<Integer> enabledLevels) {
        return highlight(root, enabledLevels, root.range());
    }

    /**
     * @param enabledLevels levels whose features are active; an empty set yields no spans
     * @param range         spans are clipped to this range, subtrees outside it are skipped
     * @return disjoint spans ordered by start offset
     */
    public List<HighlightSpan> highlight(@NotNull SyntaxNode root,
                                         @NotNull Collection<Integer> enabledLevels,
                                         @NotNull TextRange range) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(enabledLevels, "enabledLevels");
        Objects.requireNonNull(range, "range");
        if (enabledLevels.isEmpty()) {
            return List.of();
        }

        List<HighlightRule> active = new ArrayList<>();
        List<HighlightRule> errors = new ArrayList<>();
        for (HighlightFeature feature : table.getFeatures()) {
            if (feature.isError()) {
                errors.addAll(feature.rules());
            } else if (enabledLevels.contains(feature.level())) {
                active.addAll(feature.rules());
            }
        }
        // error rules go last so nothing can paint over them
        active.addAll(errors);

        List<List<QueryMatch>> matches = collectMatches(root, active, range);

        int clipStart = Math.max(root.startOffset(), range.start());
        int clipEnd = Math.min(root.endOffset(), range.end());
        SpanPainter painter = new SpanPainter(clipStart, clipEnd);
        for (int i = 0; i < active.size(); i++) {
            HighlightRule rule = active.get(i);
            for (QueryMatch match : matches.get(i)) {
                for (QueryCapture capture : match.captures()) {
                    if (capture.isInternal()) continue;
                    SyntaxNode node = capture.node();
                    if (rule.override()) {
                        painter.paintOver(node.startOffset(), node.endOffset(), capture.name());
                    } else {
                        painter.paintGaps(node.startOffset(), node.endOffset(), capture.name());
                    }
                }
            }
        }

        List<HighlightSpan> spans = painter.toSpans();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Highlighted " + range + " with " + active.size() + " rules, levels=" + enabledLevels
                    + ": " + spans.size() + " spans");
        }
        return spans;
    }

    private static List<List<QueryMatch>> collectMatches(SyntaxNode root, List<HighlightRule> rules, TextRange range) {
        List<List<QueryMatch>> matches = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            matches.add(new ArrayList<>());
        }

        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        int visited = 0;
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (!overlaps(node, range)) continue;
            visited++;

            for (int i = 0; i < rules.size(); i++) {
                List<QueryMatch> found = rules.get(i).query().matchAt(node);
                if (!found.isEmpty()) {
                    matches.get(i).addAll(found);
                }
            }

            List<? extends SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("Visited " + visited + " nodes");
        }
        return matches;
    }

    private static boolean overlaps(SyntaxNode node, TextRange range) {
        if (node.startOffset() == node.endOffset()) {
            return node.startOffset() >= range.start() && node.startOffset() <= range.end();
        }
        return range.intersects(node.startOffset(), node.endOffset());
    }
}
