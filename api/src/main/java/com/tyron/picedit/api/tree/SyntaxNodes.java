package com.tyron.picedit.api.tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Navigation and text-position helpers shared by the engines.
 */
public final class SyntaxNodes {

    private SyntaxNodes() {
    }

    /**
     * @return the deepest node whose range contains {@code offset}, or null if the offset is
     * outside {@code root}.
     */
    public static @Nullable SyntaxNode descendantAt(@NotNull SyntaxNode root, int offset) {
        if (offset < root.startOffset() || offset >= root.endOffset()) {
            return null;
        }
        SyntaxNode current = root;
        outer:
        while (true) {
            for (SyntaxNode child : current.children()) {
                if (child.startOffset() <= offset && offset < child.endOffset()) {
                    current = child;
                    continue outer;
                }
                if (child.startOffset() > offset) {
                    break;
                }
            }
            return current;
        }
    }

    /**
     * @return the index of {@code node} among its parent's children, or -1 for the root.
     */
    public static int indexInParent(@NotNull SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent == null) {
            return -1;
        }
        for (int i = 0; i < parent.childCount(); i++) {
            if (parent.child(i) == node) {
                return i;
            }
        }
        return -1;
    }

    public static int lineStartOffset(@NotNull CharSequence text, int offset) {
        int i = Math.min(offset, text.length());
        while (i > 0 && text.charAt(i - 1) != '\n') {
            i--;
        }
        return i;
    }

    /**
     * @return the offset of the first character on the line that is neither a space nor a tab.
     */
    public static int firstNonBlankOffset(@NotNull CharSequence text, int offset) {
        int i = lineStartOffset(text, offset);
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    /**
     * Visual column of {@code offset}, expanding tabs to multiples of {@code tabWidth}.
     */
    public static int column(@NotNull CharSequence text, int offset, int tabWidth) {
        int lineStart = lineStartOffset(text, offset);
        int column = 0;
        for (int i = lineStart; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\t') {
                column = (column / tabWidth + 1) * tabWidth;
            } else {
                column++;
            }
        }
        return column;
    }

    /**
     * @return the indentation column of the line containing {@code offset}.
     */
    public static int indentationOfLine(@NotNull CharSequence text, int offset, int tabWidth) {
        return column(text, firstNonBlankOffset(text, offset), tabWidth);
    }
}
