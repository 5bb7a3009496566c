package com.tyron.picedit.core.query;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.testFramework.BaseTreeTest;
import com.tyron.picedit.testFramework.TestSyntaxNode;
import com.tyron.picedit.testFramework.TestSyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.tyron.picedit.testFramework.SourceTreeBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

public class QueryMatchTest extends BaseTreeTest {

    private TestSyntaxTree tree;

    @Override
    protected void beforeEach() {
        tree = tree("x = sqrt(2); y = myMacro(2)",
                node("program",
                        node("assignment",
                                field("lhs", leaf("variable", "x")),
                                token("="),
                                field("rhs", call("sqrt"))),
                        token(";"),
                        node("assignment",
                                field("lhs", leaf("variable", "y")),
                                token("="),
                                field("rhs", call("myMacro")))));
    }

    private static Spec call(String name) {
        return node("call",
                field("function", leaf("identifier", name)),
                field("arguments", node("arguments", token("("), leaf("number", "2"), token(")"))));
    }

    private List<TestSyntaxNode> calls() {
        return tree.nodes().stream().filter(n -> n.type().equals("call")).toList();
    }

    @Test
    public void predicateDiscriminatesSameStructure() {
        Query builtin = Query.compile(
                "((call function: (identifier) @builtin) (#match? @builtin \"^(sqrt|sin|cos)$\"))");
        Query other = Query.compile(
                "((call function: (identifier) @call) (#not-match? @call \"^(sqrt|sin|cos)$\"))");

        TestSyntaxNode sqrt = calls().get(0);
        TestSyntaxNode macro = calls().get(1);

        assertEquals(1, builtin.matchAt(sqrt).size());
        assertEquals("sqrt", builtin.matchAt(sqrt).get(0).node("builtin").text());
        assertTrue(builtin.matchAt(macro).isEmpty());

        assertTrue(other.matchAt(sqrt).isEmpty());
        assertEquals("myMacro", other.matchAt(macro).get(0).node("call").text());
    }

    @Test
    public void fieldConstraintMustHold() {
        Query q = Query.compile("(assignment lhs: (variable) @lhs rhs: (call) @rhs)");
        SyntaxNode assignment = tree.find("assignment");

        QueryMatch m = q.matchAt(assignment).get(0);
        assertEquals("x", m.node("lhs").text());
        assertEquals("sqrt(2)", m.node("rhs").text());

        assertTrue(Query.compile("(assignment lhs: (call))").matchAt(assignment).isEmpty());
        assertTrue(Query.compile("(assignment body: (_))").matchAt(assignment).isEmpty());
    }

    @Test
    public void unfieldedChildrenMatchOrderedSubsequence() {
        SyntaxNode arguments = tree.find("arguments");

        assertEquals(1, Query.compile("(arguments \"(\" @open \")\" @close)").matchAt(arguments).size());
        assertEquals(1, Query.compile("(arguments (number) \")\")").matchAt(arguments).size());
        assertTrue(Query.compile("(arguments \")\" \"(\")").matchAt(arguments).isEmpty());
        // named patterns never match anonymous tokens
        assertTrue(Query.compile("(arguments (_) (_))").matchAt(arguments).isEmpty());
        assertEquals(1, Query.compile("(arguments _ _ _)").matchAt(arguments).size());
    }

    @Test
    public void sequenceBacktracksOverChildChoice() {
        // "=" is skipped: (_) only matches named children
        Query q = Query.compile("(assignment (_) @first (_) @second)");
        QueryMatch m = q.matchAt(tree.find("assignment")).get(0);

        assertEquals("x", m.node("first").text());
        assertEquals("sqrt(2)", m.node("second").text());
    }

    @Test
    public void literalMatchesOnlyAnonymousTokens() {
        TestSyntaxNode open = tree.find("(");
        assertEquals(1, Query.compile("\"(\" @bracket").matchAt(open).size());
        assertTrue(Query.compile("\"(\" @bracket").matchAt(tree.find("number")).isEmpty());
    }

    @Test
    public void alternationTriesEachAlternative() {
        Query q = Query.compile("[(variable) (number)] @constantish");
        assertEquals(1, q.matchAt(tree.find("variable")).size());
        assertEquals(1, q.matchAt(tree.find("number")).size());
        assertTrue(q.matchAt(tree.find("identifier")).isEmpty());
    }

    @Test
    public void eqAndAnyOfPredicates() {
        SyntaxNode first = tree.find("variable", "x");
        SyntaxNode second = tree.find("variable", "y");

        Query eq = Query.compile("((variable) @v (#eq? @v \"x\"))");
        assertEquals(1, eq.matchAt(first).size());
        assertTrue(eq.matchAt(second).isEmpty());

        Query notEq = Query.compile("((variable) @v (#not-eq? @v \"x\"))");
        assertTrue(notEq.matchAt(first).isEmpty());

        Query anyOf = Query.compile("((variable) @v (#any-of? @v \"a\" \"y\"))");
        assertEquals(1, anyOf.matchAt(second).size());
    }

    @Test
    public void predicateInsideNodePatternApplies() {
        Query q = Query.compile("(call function: (identifier) @f (#eq? @f \"myMacro\")) @whole");
        assertTrue(q.matchAt(calls().get(0)).isEmpty());
        assertEquals(List.of("whole", "f"),
                q.matchAt(calls().get(1)).get(0).captures().stream().map(QueryCapture::name).toList());
    }

    @Test
    public void errorPatternMatchesAnyErrorNode() {
        TestSyntaxTree broken = tree("box \"unterminated",
                node("program",
                        node("element", leaf("primitive", "box")),
                        errorLeaf("\"unterminated")));

        Query q = Query.compile("(ERROR) @error");
        assertEquals(1, q.matchAt(broken.find("ERROR")).size());
        assertTrue(q.matchAt(broken.find("element")).isEmpty());
    }

    @Test
    public void internalCapturesAreFlagged() {
        QueryMatch m = Query.compile("((identifier) @_name @function)").matchAt(tree.find("identifier")).get(0);

        assertTrue(m.captures().get(0).isInternal());
        assertFalse(m.captures().get(1).isInternal());
        assertEquals(Set.of("_name", "function"), m.asMap().keySet());
    }

    @Test
    public void failedMatchLeavesNoPartialCaptures() {
        List<QueryCapture> captures = new ArrayList<>();
        Query q = Query.compile("(assignment lhs: (variable) @v rhs: (number) @n)");

        assertFalse(QueryMatcher.matches(q.getEntries().get(0).pattern(), tree.find("assignment"), captures));
        assertTrue(captures.isEmpty());
    }
}
