package com.tyron.picedit.api.editor;

import com.tyron.picedit.api.tree.TextRange;

import java.util.Objects;

/**
 * A range of text tagged with a highlight category such as {@code "keyword"}.
 * <p>
 * Mapping a category to a colour or font is up to the editor.
 */
public record HighlightSpan(int start, int end, String category) {

    public HighlightSpan {
        Objects.requireNonNull(category, "category");
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Empty or negative span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public TextRange range() {
        return new TextRange(start, end);
    }
}
