package com.tyron.picedit.api.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxNodesTest {

    @Test
    public void lineStartAndFirstNonBlank() {
        String text = "box\n    circle\n\t[\n";
        int circle = text.indexOf("circle");

        assertEquals(4, SyntaxNodes.lineStartOffset(text, circle));
        assertEquals(circle, SyntaxNodes.firstNonBlankOffset(text, circle + 3));
        assertEquals(0, SyntaxNodes.lineStartOffset(text, 2));
    }

    @Test
    public void columnExpandsTabs() {
        String text = "x\n\t  [";
        int bracket = text.indexOf('[');

        assertEquals(10, SyntaxNodes.column(text, bracket, 8));
        assertEquals(6, SyntaxNodes.column(text, bracket, 4));
        assertEquals(10, SyntaxNodes.indentationOfLine(text, bracket, 8));
    }

    @Test
    public void blankLineHasZeroIndentationUpToNewline() {
        String text = "a\n\nb";
        assertEquals(0, SyntaxNodes.indentationOfLine(text, 2, 8));
    }

    @Test
    public void rangeRejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> new TextRange(5, 2));
        TextRange r = new TextRange(2, 6);
        assertTrue(r.contains(2));
        assertFalse(r.contains(6));
        assertTrue(r.intersects(5, 9));
        assertFalse(r.intersects(6, 9));
    }
}
