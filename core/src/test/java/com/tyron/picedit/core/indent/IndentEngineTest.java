package com.tyron.picedit.core.indent;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.core.rules.NodeVocabulary;
import com.tyron.picedit.core.rules.RuleTableException;
import com.tyron.picedit.testFramework.BaseTreeTest;
import com.tyron.picedit.testFramework.TestSyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tyron.picedit.core.indent.IndentCondition.Kind.*;
import static com.tyron.picedit.testFramework.SourceTreeBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

public class IndentEngineTest extends BaseTreeTest {

    private static final NodeVocabulary VOCABULARY = NodeVocabulary.of(
            List.of("program", "loop", "block", "stmt"),
            List.of("loop", "{", "}"),
            List.of("body"));

    private static final String FLAT = "loop {\n    body\n\n}\n";
    private static final String NESTED = "loop {\n\tloop {\n\t\tbody\n\t}\n}\n";

    private IndentRuleTable table;
    private TestSyntaxTree flat;
    private TestSyntaxTree nested;

    @Override
    protected void beforeEach() {
        table = IndentRuleTable.builder(VOCABULARY)
                .rule("closing", IndentAnchor.GRANDPARENT, 0, 0, IndentCondition.of(NODE_IS, "}"))
                .rule("top-level", IndentAnchor.COLUMN_ZERO, 0, 0, IndentCondition.of(PARENT_IS, "program"))
                .rule("block", IndentAnchor.PARENT_BOL, 1, 0, IndentCondition.of(PARENT_IS, "block"))
                .catchAll("default", IndentAnchor.PARENT_BOL, 0, 0)
                .build();

        flat = tree(FLAT,
                node("program",
                        node("loop",
                                token("loop"),
                                field("body", node("block", token("{"), leaf("stmt", "body"), token("}"))))));

        nested = tree(NESTED,
                node("program",
                        node("loop",
                                token("loop"),
                                field("body", node("block",
                                        token("{"),
                                        node("loop",
                                                token("loop"),
                                                field("body", node("block", token("{"), leaf("stmt", "body"), token("}")))),
                                        token("}"))))));
    }

    @Test
    public void blockContentsIndentOneUnit() {
        IndentEngine engine = new IndentEngine(table);

        assertEquals(0, engine.indentOf(flat.find("loop"), 2));
        assertEquals(2, engine.indentOf(flat.find("stmt"), 2));
        assertEquals(4, engine.indentOf(flat.find("stmt"), 4));
        assertEquals(0, engine.indentOf(flat.find("}", "}"), 2));
    }

    @Test
    public void tabsExpandToTabWidth() {
        SyntaxNode body = nested.find("stmt");
        SyntaxNode innerLoop = body.parent().parent();
        SyntaxNode innerClose = body.nextSibling();

        IndentEngine wide = new IndentEngine(table, 8);
        assertEquals(2, wide.indentOf(innerLoop, 2));
        assertEquals(10, wide.indentOf(body, 2));
        assertEquals(8, wide.indentOf(innerClose, 2));

        IndentEngine narrow = new IndentEngine(table, 4);
        assertEquals(6, narrow.indentOf(body, 2));
        assertEquals(4, narrow.indentOf(innerClose, 2));
    }

    @Test
    public void reportsWinningRule() {
        IndentEngine engine = new IndentEngine(table);

        IndentResult result = engine.resolve(IndentContext.of(flat.find("}", "}")), 2);
        assertEquals("closing", result.rule().name());
        assertEquals(0, result.column());
    }

    @Test
    public void firstMatchingRuleWins() {
        IndentRuleTable reordered = IndentRuleTable.builder(VOCABULARY)
                .rule("block", IndentAnchor.PARENT_BOL, 1, 0, IndentCondition.of(PARENT_IS, "block"))
                .rule("closing", IndentAnchor.GRANDPARENT, 0, 0, IndentCondition.of(NODE_IS, "}"))
                .catchAll("default", IndentAnchor.PARENT_BOL, 0, 0)
                .build();
        SyntaxNode close = flat.find("}", "}");

        assertEquals(0, new IndentEngine(table).indentOf(close, 2));
        assertEquals(2, new IndentEngine(reordered).indentOf(close, 2));
    }

    @Test
    public void sameInputSameColumn() {
        IndentEngine engine = new IndentEngine(table);
        SyntaxNode body = nested.find("stmt");

        assertEquals(engine.indentOf(body, 3), engine.indentOf(body, 3));
    }

    @Test
    public void negativeOffsetsAreFlooredAtZero() {
        IndentRuleTable dedent = IndentRuleTable.builder(VOCABULARY)
                .catchAll("dedent", IndentAnchor.PARENT, -2, -1)
                .build();

        assertEquals(0, new IndentEngine(dedent).indentOf(flat.find("stmt"), 4));
    }

    @Test
    public void missingGrandparentAnchorsAtColumnZero() {
        IndentRuleTable t = IndentRuleTable.builder(VOCABULARY)
                .catchAll("grandparent", IndentAnchor.GRANDPARENT, 1, 1)
                .build();

        // loop -> program -> (none)
        assertEquals(3, new IndentEngine(t).indentOf(flat.find("loop"), 2));
    }

    @Test
    public void parentAnchorUsesParentStartColumn() {
        IndentRuleTable t = IndentRuleTable.builder(VOCABULARY)
                .catchAll("parent", IndentAnchor.PARENT, 0, 1)
                .build();

        // the block starts at "{", column 5 of the first line
        assertEquals(6, new IndentEngine(t).indentOf(flat.find("stmt"), 2));
    }

    @Test
    public void fieldSiblingAndTextConditions() {
        SyntaxNode block = flat.find("block");
        SyntaxNode body = flat.find("stmt");

        assertTrue(IndentCondition.of(FIELD_IS, "body").test(IndentContext.of(block)));
        assertFalse(IndentCondition.of(FIELD_IS, "body").test(IndentContext.of(body)));
        assertTrue(IndentCondition.of(PREV_SIBLING_IS, "{").test(IndentContext.of(body)));
        assertTrue(IndentCondition.of(NODE_TEXT_IS, "body").test(IndentContext.of(body)));
        assertTrue(IndentCondition.of(GRANDPARENT_IS, "loop").test(IndentContext.of(body)));
        assertTrue(IndentCondition.not(PARENT_IS, "program").test(IndentContext.of(body)));
        assertFalse(IndentCondition.of(NO_NODE).test(IndentContext.of(body)));
    }

    @Test
    public void rejectsNonPositiveUnit() {
        IndentEngine engine = new IndentEngine(table);

        assertThrows(IllegalArgumentException.class, () -> engine.indentOf(flat.find("stmt"), 0));
        assertThrows(IllegalArgumentException.class, () -> engine.indentOf(flat.find("stmt"), -2));
        assertThrows(IllegalArgumentException.class, () -> new IndentEngine(table, 0));
    }

    @Test
    public void indentAtLineStarts() {
        IndentEngine engine = new IndentEngine(table);

        assertEquals(0, engine.indentAt(flat, 0, 2));
        assertEquals(2, engine.indentAt(flat, FLAT.indexOf("body") + 2, 2));
        assertEquals(0, engine.indentAt(flat, FLAT.indexOf('}'), 2));
        assertEquals(2, engine.indentAt(nested, NESTED.indexOf("\tloop"), 2));
    }

    @Test
    public void indentAtBlankLineUsesEnclosingNode() {
        IndentEngine engine = new IndentEngine(table);
        int blank = FLAT.indexOf("\n\n") + 1;

        IndentContext context = engine.contextAt(flat, blank);
        assertNull(context.node());
        assertEquals("block", context.parent().type());
        assertEquals(2, engine.indentAt(flat, blank, 2));

        // after the trailing newline only the root encloses the position
        IndentContext end = engine.contextAt(flat, FLAT.length());
        assertNull(end.node());
        assertEquals("program", end.parent().type());
        assertEquals(0, engine.indentAt(flat, FLAT.length(), 2));
    }

    @Test
    public void indentAtClimbsToLargestNodeOnTheLine() {
        IndentEngine engine = new IndentEngine(table);

        IndentContext context = engine.contextAt(nested, NESTED.indexOf("\tloop") + 1);
        assertEquals("loop", context.node().type());
        assertEquals("block", context.parent().type());
    }

    @Test
    public void indentAtRejectsOffsetsOutsideText() {
        IndentEngine engine = new IndentEngine(table);

        assertThrows(IllegalArgumentException.class, () -> engine.indentAt(flat, -1, 2));
        assertThrows(IllegalArgumentException.class, () -> engine.indentAt(flat, FLAT.length() + 1, 2));
    }

    @Test
    public void overflowingUnitIsRejected() {
        IndentEngine engine = new IndentEngine(table, 8);
        SyntaxNode body = nested.find("stmt");

        assertThrows(IllegalArgumentException.class, () -> engine.indentOf(body, Integer.MAX_VALUE));
        assertEquals(0, engine.indentOf(nested.find("loop"), Integer.MAX_VALUE));
    }

    @Test
    public void tableValidation() {
        assertThrows(RuleTableException.class, () -> IndentRuleTable.builder(VOCABULARY).build());
        assertThrows(RuleTableException.class, () -> IndentRuleTable.builder(VOCABULARY)
                .rule("only", IndentAnchor.PARENT, 0, 0, IndentCondition.of(NODE_IS, "stmt"))
                .build());
        assertThrows(RuleTableException.class, () -> IndentRuleTable.builder(VOCABULARY)
                .catchAll("first", IndentAnchor.PARENT, 0, 0)
                .catchAll("second", IndentAnchor.PARENT, 0, 0)
                .build());
        assertThrows(RuleTableException.class, () -> IndentRuleTable.builder(VOCABULARY)
                .rule("typo", IndentAnchor.PARENT, 0, 0, IndentCondition.of(PARENT_IS, "blok"))
                .catchAll("default", IndentAnchor.PARENT, 0, 0)
                .build());
        assertThrows(RuleTableException.class, () -> IndentRuleTable.builder(VOCABULARY)
                .rule("empty", IndentAnchor.PARENT, 0, 0, IndentCondition.of(NODE_IS))
                .catchAll("default", IndentAnchor.PARENT, 0, 0)
                .build());
        assertThrows(RuleTableException.class, () -> IndentRuleTable.builder(VOCABULARY)
                .rule("never", IndentAnchor.PARENT, 0, 0, IndentCondition.not(CATCH_ALL))
                .catchAll("default", IndentAnchor.PARENT, 0, 0)
                .build());
        assertThrows(RuleTableException.class, () -> IndentRuleTable.builder(VOCABULARY)
                .rule("field", IndentAnchor.PARENT, 0, 0, IndentCondition.of(FIELD_IS, "condition"))
                .catchAll("default", IndentAnchor.PARENT, 0, 0)
                .build());
    }
}
