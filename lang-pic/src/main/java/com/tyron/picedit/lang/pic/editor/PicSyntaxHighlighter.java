package com.tyron.picedit.lang.pic.editor;

import com.tyron.picedit.api.editor.HighlightSpan;
import com.tyron.picedit.api.editor.SyntaxHighlighter;
import com.tyron.picedit.api.tree.SyntaxTree;
import com.tyron.picedit.api.tree.TextRange;
import com.tyron.picedit.core.highlight.HighlightEngine;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Highlights pic trees, remembering the last result.
 * <p>
 * The result is reused only for the same tree at the same generation, level set and
 * range; a re-parse bumps the generation and invalidates it.
 */
public class PicSyntaxHighlighter implements SyntaxHighlighter {

    private static final Logger LOG = Logger.getLogger(PicSyntaxHighlighter.class.getName());

    private record Cached(SyntaxTree tree, long generation, Set<Integer> levels, TextRange range,
                          List<HighlightSpan> spans) {

        boolean isFor(SyntaxTree tree, Set<Integer> levels, TextRange range) {
            return this.tree == tree
                    && generation == tree.generation()
                    && this.levels.equals(levels)
                    && this.range.equals(range);
        }
    }

    private final HighlightEngine engine;
    private final AtomicReference<Cached> last = new AtomicReference<>();
    private volatile Set<Integer> levels;

    public PicSyntaxHighlighter(@NotNull HighlightEngine engine, @NotNull Set<Integer> levels) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.levels = Set.copyOf(levels);
    }

    public Set<Integer> getLevels() {
        return levels;
    }

    public void setLevels(@NotNull Set<Integer> levels) {
        this.levels = Set.copyOf(levels);
    }

    @Override
    public List<HighlightSpan> highlight(@NotNull SyntaxTree tree, @NotNull TextRange range) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(range, "range");
        Set<Integer> enabled = levels;

        Cached cached = last.get();
        if (cached != null && cached.isFor(tree, enabled, range)) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Reusing spans for generation " + cached.generation());
            }
            return cached.spans();
        }

        long generation = tree.generation();
        List<HighlightSpan> spans = List.copyOf(engine.highlight(tree.root(), enabled, range));
        last.set(new Cached(tree, generation, enabled, range, spans));
        return spans;
    }
}
