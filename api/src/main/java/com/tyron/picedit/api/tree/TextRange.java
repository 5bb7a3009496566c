package com.tyron.picedit.api.tree;

/**
 * Half-open range of character offsets {@code [start, end)}.
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean intersects(int otherStart, int otherEnd) {
        return otherStart < end && start < otherEnd;
    }
}
