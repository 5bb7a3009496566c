package com.tyron.picedit.core.highlight;

import java.util.Set;
import java.util.TreeSet;

/**
 * Activation levels run from {@link #MIN_LEVEL} to {@link #MAX_LEVEL}. Enabling a level
 * conventionally enables every lower level too; the engine itself honours any set it is given.
 */
public final class HighlightLevels {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 4;

    private HighlightLevels() {
    }

    /**
     * @return {@code {1..level}}
     */
    public static Set<Integer> upTo(int level) {
        checkLevel(level);
        Set<Integer> out = new TreeSet<>();
        for (int i = MIN_LEVEL; i <= level; i++) {
            out.add(i);
        }
        return Set.copyOf(out);
    }

    public static Set<Integer> of(int... levels) {
        Set<Integer> out = new TreeSet<>();
        for (int level : levels) {
            checkLevel(level);
            out.add(level);
        }
        return Set.copyOf(out);
    }

    static void checkLevel(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Highlight level must be in [" + MIN_LEVEL + ", " + MAX_LEVEL + "], got " + level);
        }
    }
}
