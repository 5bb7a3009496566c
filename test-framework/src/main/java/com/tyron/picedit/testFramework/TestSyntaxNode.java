package com.tyron.picedit.testFramework;

import com.tyron.picedit.api.tree.SyntaxNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TestSyntaxNode implements SyntaxNode {

    private final TestSyntaxTree tree;
    private final String type;
    private final boolean named;
    private final boolean error;
    private final int start;
    private final int end;
    private final List<TestSyntaxNode> children = new ArrayList<>();
    private final List<String> fieldNames = new ArrayList<>();
    private TestSyntaxNode parent;

    TestSyntaxNode(TestSyntaxTree tree, String type, boolean named, boolean error, int start, int end) {
        this.tree = tree;
        this.type = type;
        this.named = named;
        this.error = error;
        this.start = start;
        this.end = end;
    }

    void addChild(@Nullable String fieldName, TestSyntaxNode child) {
        child.parent = this;
        children.add(child);
        fieldNames.add(fieldName);
    }

    @Override
    public @NotNull String type() {
        return type;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isError() {
        return error;
    }

    @Override
    public int startOffset() {
        return start;
    }

    @Override
    public int endOffset() {
        return end;
    }

    @Override
    public @Nullable TestSyntaxNode parent() {
        return parent;
    }

    @Override
    public @NotNull List<TestSyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public @Nullable String fieldNameOfChild(int index) {
        return fieldNames.get(index);
    }

    @Override
    public @Nullable TestSyntaxNode previousSibling() {
        if (parent == null) return null;
        int i = parent.children.indexOf(this);
        return i > 0 ? parent.children.get(i - 1) : null;
    }

    @Override
    public @Nullable TestSyntaxNode nextSibling() {
        if (parent == null) return null;
        int i = parent.children.indexOf(this);
        return i >= 0 && i + 1 < parent.children.size() ? parent.children.get(i + 1) : null;
    }

    @Override
    public @NotNull TestSyntaxTree tree() {
        return tree;
    }

    @Override
    public String toString() {
        return type + "[" + start + ", " + end + ")";
    }
}
