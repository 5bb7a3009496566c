package com.tyron.picedit.core.indent;

import com.tyron.picedit.api.tree.SyntaxNode;
import com.tyron.picedit.api.tree.SyntaxNodes;
import com.tyron.picedit.api.tree.SyntaxTree;
import com.tyron.picedit.core.rules.RuleTableException;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the indentation column for the node that starts a line by evaluating an
 * {@link IndentRuleTable} in order. Stateless; safe to share between threads.
 */
public final class IndentEngine {

    private static final Logger LOG = Logger.getLogger(IndentEngine.class.getName());

    private final IndentRuleTable table;
    private final int tabWidth;

    public IndentEngine(@NotNull IndentRuleTable table, int tabWidth) {
        this.table = Objects.requireNonNull(table, "table");
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive, got " + tabWidth);
        }
        this.tabWidth = tabWidth;
    }

    public IndentEngine(@NotNull IndentRuleTable table) {
        this(table, 8);
    }

    public IndentRuleTable getTable() {
        return table;
    }

    /**
     * @param node       the node that starts the line
     * @param indentUnit columns per indentation level, positive
     * @return a non-negative column
     */
    public int indentOf(@NotNull SyntaxNode node, int indentUnit) {
        Objects.requireNonNull(node, "node");
        return resolve(IndentContext.of(node), indentUnit).column();
    }

    /**
     * Indents the line containing {@code offset}. The node starting the line is the largest
     * node that begins at the line's first non-blank character, stopping below the root.
     * On a blank line there is no node and the smallest node enclosing the line is the parent.
     */
    public int indentAt(@NotNull SyntaxTree tree, int offset, int indentUnit) {
        return resolve(contextAt(tree, offset), indentUnit).column();
    }

    public IndentContext contextAt(@NotNull SyntaxTree tree, int offset) {
        Objects.requireNonNull(tree, "tree");
        CharSequence text = tree.text();
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset " + offset + " outside [0, " + text.length() + "]");
        }
        SyntaxNode root = tree.root();
        int bol = SyntaxNodes.firstNonBlankOffset(text, offset);

        boolean blank = bol >= text.length() || text.charAt(bol) == '\n' || text.charAt(bol) == '\r';
        SyntaxNode smallest = SyntaxNodes.descendantAt(root, Math.min(bol, Math.max(root.endOffset() - 1, 0)));
        if (smallest == null) {
            smallest = root;
        }
        if (blank || smallest.startOffset() != bol) {
            SyntaxNode parent = smallest;
            // the node found ends before the blank position when bol sits at its end
            while (parent.parent() != null && parent.endOffset() <= bol && parent != root) {
                parent = parent.parent();
            }
            return new IndentContext(null, parent, tree);
        }

        SyntaxNode node = smallest;
        while (node.parent() != null && node.parent() != root && node.parent().startOffset() == bol) {
            node = node.parent();
        }
        return IndentContext.of(node);
    }

    /**
     * Evaluates the rules for a context and reports the winning rule alongside the column.
     */
    public IndentResult resolve(@NotNull IndentContext context, int indentUnit) {
        Objects.requireNonNull(context, "context");
        if (indentUnit <= 0) {
            throw new IllegalArgumentException("indentUnit must be positive, got " + indentUnit);
        }
        IndentRule rule = table.firstMatch(context);
        if (rule == null) {
            // IndentRuleTable refuses tables without a trailing catch-all
            throw new RuleTableException("No indentation rule matched " + context);
        }
        int column;
        try {
            column = Math.max(0, Math.addExact(rule.anchor().column(context, tabWidth), rule.offset(indentUnit)));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Indentation overflows for unit " + indentUnit
                    + " via '" + rule.name() + "'", e);
        }
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("Indent " + context.node() + " -> " + column + " via '" + rule.name() + "'");
        }
        return new IndentResult(column, rule);
    }
}
