package com.tyron.picedit.lang.pic.editor;

import com.tyron.picedit.api.editor.HighlightSpan;
import com.tyron.picedit.api.tree.TextRange;
import com.tyron.picedit.core.highlight.HighlightLevels;
import com.tyron.picedit.lang.pic.BasePicTest;
import com.tyron.picedit.testFramework.TestLogging;
import com.tyron.picedit.testFramework.TestSyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

public class PicSyntaxHighlighterTest extends BasePicTest {

    private PicSyntaxHighlighter highlighter;

    @Override
    protected void setUpTest() {
        highlighter = new PicSyntaxHighlighter(highlightEngine, HighlightLevels.upTo(2));
    }

    @Test
    public void reusesResultForSameGeneration() {
        TestSyntaxTree t = ifTree();

        try (TestLogging.Capture log = TestLogging.capture(PicSyntaxHighlighter.class)) {
            List<HighlightSpan> first = highlighter.highlight(t);
            List<HighlightSpan> second = highlighter.highlight(t);

            assertSame(first, second);
            assertTrue(log.contains(Level.FINE, "generation " + t.generation()));
        }
    }

    @Test
    public void callersCannotAlterCachedResult() {
        TestSyntaxTree t = ifTree();
        List<HighlightSpan> expected = highlightEngine.highlight(t.root(), HighlightLevels.upTo(2));

        List<HighlightSpan> first = highlighter.highlight(t);
        assertFalse(first.isEmpty());
        assertThrows(UnsupportedOperationException.class, first::clear);
        assertThrows(UnsupportedOperationException.class, () -> first.remove(0));

        assertEquals(expected, highlighter.highlight(t));
    }

    @Test
    public void recomputesForAnotherTree() {
        TestSyntaxTree before = ifTree();
        TestSyntaxTree after = ifTree();
        assertNotEquals(before.generation(), after.generation());

        List<HighlightSpan> first = highlighter.highlight(before);
        List<HighlightSpan> second = highlighter.highlight(after);

        assertNotSame(first, second);
        assertEquals(first, second);
    }

    @Test
    public void recomputesWhenLevelsOrRangeChange() {
        TestSyntaxTree t = callsTree();

        List<HighlightSpan> levelTwo = highlighter.highlight(t);
        highlighter.setLevels(HighlightLevels.upTo(4));
        List<HighlightSpan> levelFour = highlighter.highlight(t);

        assertNotEquals(levelTwo, levelFour);
        assertEquals("function-call", categoryOf(t, levelFour, "myMacro"));

        List<HighlightSpan> clipped = highlighter.highlight(t, new TextRange(0, 3));
        assertNotSame(levelFour, clipped);
        assertWellFormed(clipped, 0, 3);
    }

    @Test
    public void emptyLevelSetHighlightsNothing() {
        highlighter.setLevels(Set.of());

        assertTrue(highlighter.highlight(ifTree()).isEmpty());
    }
}
