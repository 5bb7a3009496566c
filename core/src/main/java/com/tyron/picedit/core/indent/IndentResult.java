package com.tyron.picedit.core.indent;

/**
 * A resolved indentation: the column and the rule that produced it.
 */
public record IndentResult(int column, IndentRule rule) {
}
