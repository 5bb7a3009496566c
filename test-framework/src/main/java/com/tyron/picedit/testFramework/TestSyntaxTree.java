package com.tyron.picedit.testFramework;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.api.tree.SyntaxTree;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory {@link SyntaxTree} standing in for an external parser's output in tests.
 */
public final class TestSyntaxTree implements SyntaxTree {

    private final String text;
    private final long generation;
    private TestSyntaxNode root;

    TestSyntaxTree(String text, long generation) {
        this.text = text;
        this.generation = generation;
    }

    void setRoot(TestSyntaxNode root) {
        this.root = root;
    }

    @Override
    public @NotNull TestSyntaxNode root() {
        return root;
    }

    @Override
    public @NotNull CharSequence text() {
        return text;
    }

    @Override
    public long generation() {
        return generation;
    }

    /**
     * @return the first node in document order with the given type whose text equals
     * {@code text}; useful for picking the node that starts a line.
     */
    public @NotNull TestSyntaxNode find(String type, String text) {
        for (TestSyntaxNode node : nodes()) {
            if (node.type().equals(type) && node.text().equals(text)) {
                return node;
            }
        }
        throw new AssertionError("No node " + type + " with text '" + text + "'");
    }

    public @NotNull TestSyntaxNode find(String type) {
        for (TestSyntaxNode node : nodes()) {
            if (node.type().equals(type)) {
                return node;
            }
        }
        throw new AssertionError("No node of type " + type);
    }

    /**
     * @return every node in pre-order.
     */
    public List<TestSyntaxNode> nodes() {
        List<TestSyntaxNode> out = new ArrayList<>();
        collect(root, out);
        return out;
    }

    private static void collect(TestSyntaxNode node, List<TestSyntaxNode> out) {
        out.add(node);
        for (SyntaxNode child : node.children()) {
            collect((TestSyntaxNode) child, out);
        }
    }
}
