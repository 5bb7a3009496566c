package com.tyron.picedit.lang.pic.editor;

import com.tyron.picedit.api.editor.Indenter;
import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.api.tree.SyntaxTree;
import com.tyron.picedit.core.indent.IndentEngine;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public class PicIndenter implements Indenter {

    private final IndentEngine engine;
    private final int indentUnit;

    public PicIndenter(@NotNull IndentEngine engine, int indentUnit) {
        this.engine = Objects.requireNonNull(engine, "engine");
        if (indentUnit <= 0) {
            throw new IllegalArgumentException("indentUnit must be positive, got " + indentUnit);
        }
        this.indentUnit = indentUnit;
    }

    public int getIndentUnit() {
        return indentUnit;
    }

    @Override
    public int indentOf(@NotNull SyntaxNode node) {
        return engine.indentOf(node, indentUnit);
    }

    @Override
    public int indentAt(@NotNull SyntaxTree tree, int offset) {
        return engine.indentAt(tree, offset, indentUnit);
    }
}
