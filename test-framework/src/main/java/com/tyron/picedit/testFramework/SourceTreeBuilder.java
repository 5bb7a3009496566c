package com.tyron.picedit.testFramework;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds a {@link TestSyntaxTree} over real source text.
 * <p>
 * Leaves are located in the source in declaration order, so a test only spells out the
 * tree shape and the token texts; offsets always agree with the text. Interior nodes span
 * from their first to their last child. The root always covers the whole source.
 *
 * <pre>{@code
 * TestSyntaxTree t = tree("box; circle",
 *         node("program",
 *                 node("element", leaf("primitive", "box")),
 *                 token(";"),
 *                 node("element", leaf("primitive", "circle"))));
 * }</pre>
 */
public final class SourceTreeBuilder {

    private static final AtomicLong GENERATIONS = new AtomicLong();

    private SourceTreeBuilder() {
    }

    public static TestSyntaxTree tree(String source, Spec root) {
        Objects.requireNonNull(source, "source");
        TestSyntaxTree tree = new TestSyntaxTree(source, GENERATIONS.incrementAndGet());
        Cursor cursor = new Cursor(source);
        List<TestSyntaxNode> children = new ArrayList<>();
        for (Spec child : root.children) {
            children.add(build(tree, cursor, child));
        }
        TestSyntaxNode rootNode = new TestSyntaxNode(tree, root.type, true, root.error, 0, source.length());
        for (int i = 0; i < children.size(); i++) {
            rootNode.addChild(root.children.get(i).field, children.get(i));
        }
        tree.setRoot(rootNode);
        return tree;
    }

    /**
     * Named interior node.
     */
    public static Spec node(String type, Spec... children) {
        return new Spec(type, true, false, null, Arrays.asList(children));
    }

    /**
     * Named leaf whose text is located in the source.
     */
    public static Spec leaf(String type, String text) {
        return new Spec(type, true, false, text, List.of());
    }

    /**
     * Anonymous token; its type is its text.
     */
    public static Spec token(String text) {
        return new Spec(text, false, false, text, List.of());
    }

    /**
     * An {@code ERROR} node wrapping whatever the parser could not place.
     */
    public static Spec error(Spec... children) {
        return new Spec("ERROR", true, true, null, Arrays.asList(children));
    }

    /**
     * An {@code ERROR} leaf, e.g. an unterminated string.
     */
    public static Spec errorLeaf(String text) {
        return new Spec("ERROR", true, true, text, List.of());
    }

    /**
     * Attaches {@code child} under a named field of its parent.
     */
    public static Spec field(String name, Spec child) {
        return child.withField(name);
    }

    private static TestSyntaxNode build(TestSyntaxTree tree, Cursor cursor, Spec spec) {
        if (spec.text != null) {
            int start = cursor.locate(spec.text);
            return new TestSyntaxNode(tree, spec.type, spec.named, spec.error, start, start + spec.text.length());
        }

        List<TestSyntaxNode> built = new ArrayList<>();
        for (Spec child : spec.children) {
            built.add(build(tree, cursor, child));
        }
        int start = built.isEmpty() ? cursor.position : built.get(0).startOffset();
        int end = built.isEmpty() ? cursor.position : built.get(built.size() - 1).endOffset();
        TestSyntaxNode node = new TestSyntaxNode(tree, spec.type, spec.named, spec.error, start, end);
        for (int i = 0; i < built.size(); i++) {
            node.addChild(spec.children.get(i).field, built.get(i));
        }
        return node;
    }

    public static final class Spec {
        private final String type;
        private final boolean named;
        private final boolean error;
        private final String text;
        private final List<Spec> children;
        private final String field;

        private Spec(String type, boolean named, boolean error, @Nullable String text, List<Spec> children) {
            this(type, named, error, text, children, null);
        }

        private Spec(String type, boolean named, boolean error, @Nullable String text, List<Spec> children, @Nullable String field) {
            this.type = type;
            this.named = named;
            this.error = error;
            this.text = text;
            this.children = children;
            this.field = field;
        }

        private Spec withField(String name) {
            return new Spec(type, named, error, text, children, name);
        }
    }

    private static final class Cursor {
        private final String source;
        private int position;

        Cursor(String source) {
            this.source = source;
        }

        int locate(String text) {
            int at = source.indexOf(text, position);
            if (at < 0) {
                throw new IllegalArgumentException("Token '" + text + "' not found after offset " + position);
            }
            position = at + text.length();
            return at;
        }
    }
}
