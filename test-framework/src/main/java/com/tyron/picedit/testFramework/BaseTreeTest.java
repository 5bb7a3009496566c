package com.tyron.picedit.testFramework;

import com.tyron.picedit.api.editor.HighlightSpan;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Base class for engine tests working on {@link TestSyntaxTree}s.
 */
public abstract class BaseTreeTest {

    @BeforeEach
    public final void baseSetUp() throws Exception {
        TestLogging.configureOnce();
        beforeEach();
    }

    /**
     * Subclasses override for per-test setup.
     */
    protected void beforeEach() throws Exception {
    }

    /**
     * @return the category painted at {@code offset}, or null if the character is unpainted.
     */
    protected static String categoryAt(List<HighlightSpan> spans, int offset) {
        for (HighlightSpan span : spans) {
            if (span.start() <= offset && offset < span.end()) {
                return span.category();
            }
        }
        return null;
    }

    /**
     * @return the category painted over the {@code occurrence}-th (0-based) appearance of
     * {@code text}, asserting every character of it carries the same category.
     */
    protected static String categoryOf(TestSyntaxTree tree, List<HighlightSpan> spans, String text, int occurrence) {
        String source = tree.text().toString();
        int at = -1;
        for (int i = 0; i <= occurrence; i++) {
            at = source.indexOf(text, at + 1);
            assertTrue(at >= 0, "'" + text + "' occurrence " + occurrence + " not in source");
        }
        String category = categoryAt(spans, at);
        for (int i = at + 1; i < at + text.length(); i++) {
            assertEquals(category, categoryAt(spans, i), "mixed categories over '" + text + "' at " + i);
        }
        return category;
    }

    protected static String categoryOf(TestSyntaxTree tree, List<HighlightSpan> spans, String text) {
        return categoryOf(tree, spans, text, 0);
    }

    /**
     * Spans are non-empty, ordered and pairwise disjoint.
     */
    protected static void assertWellFormed(List<HighlightSpan> spans, int rootStart, int rootEnd) {
        int previousEnd = rootStart;
        for (HighlightSpan span : spans) {
            assertTrue(span.start() < span.end(), "empty span " + span);
            assertTrue(span.start() >= previousEnd, "overlapping or unordered span " + span);
            assertTrue(span.end() <= rootEnd, "span outside root " + span);
            previousEnd = span.end();
        }
    }
}
