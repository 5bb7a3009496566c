package com.tyron.picedit.lang.pic;

import com.tyron.picedit.core.highlight.HighlightRuleTable;
import com.tyron.picedit.core.indent.IndentRuleTable;
import com.tyron.picedit.core.rules.NodeVocabulary;
import com.tyron.picedit.core.rules.RuleTableException;
import com.tyron.picedit.core.rules.RuleTableLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The pic grammar as the engines see it: its node vocabulary and its highlight and
 * indentation rule tables, loaded once from the resources next to this class.
 */
public final class PicLanguage {

    public static final String ID = "pic";
    public static final String FILE_EXTENSION = ".pic";

    /**
     * Functions built into pic; calls to anything else are macro or user calls.
     * Mirrors the {@code #match?} predicate of the {@code builtin} feature in
     * {@value #HIGHLIGHTS_RESOURCE}; both must be changed together.
     */
    public static final List<String> BUILTIN_FUNCTIONS = List.of(
            "sin", "cos", "atan2", "log", "exp", "sqrt", "max", "min", "int", "rand", "srand");

    static final String NODE_TYPES_RESOURCE = "pic-node-types.yaml";
    static final String HIGHLIGHTS_RESOURCE = "pic-highlights.yaml";
    static final String INDENT_RESOURCE = "pic-indent.yaml";

    private static final Logger LOG = Logger.getLogger(PicLanguage.class.getName());

    private static final class Holder {
        static final PicLanguage INSTANCE = load();
    }

    private final NodeVocabulary vocabulary;
    private final HighlightRuleTable highlightRules;
    private final IndentRuleTable indentRules;

    private PicLanguage(NodeVocabulary vocabulary, HighlightRuleTable highlightRules, IndentRuleTable indentRules) {
        this.vocabulary = vocabulary;
        this.highlightRules = highlightRules;
        this.indentRules = indentRules;
    }

    /**
     * @throws RuleTableException if a bundled table is missing or invalid
     */
    public static PicLanguage getInstance() {
        return Holder.INSTANCE;
    }

    static PicLanguage load() {
        long start = System.nanoTime();
        try {
            NodeVocabulary vocabulary = NodeVocabulary.load(open(NODE_TYPES_RESOURCE));
            RuleTableLoader loader = new RuleTableLoader(vocabulary);
            HighlightRuleTable highlights = loader.loadHighlightRules(open(HIGHLIGHTS_RESOURCE));
            IndentRuleTable indents = loader.loadIndentRules(open(INDENT_RESOURCE));

            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Loaded pic rule tables in " + (System.nanoTime() - start) / 1_000_000 + "ms");
            }
            return new PicLanguage(vocabulary, highlights, indents);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pic rule tables", e);
        }
    }

    private static InputStream open(String resource) {
        InputStream in = PicLanguage.class.getResourceAsStream(resource);
        if (in == null) {
            throw new RuleTableException("Missing resource " + resource);
        }
        return in;
    }

    public NodeVocabulary getVocabulary() {
        return vocabulary;
    }

    public HighlightRuleTable getHighlightRules() {
        return highlightRules;
    }

    public IndentRuleTable getIndentRules() {
        return indentRules;
    }
}
