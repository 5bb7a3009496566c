package com.tyron.picedit.api.language;

import com.tyron.picedit.api.editor.Indenter;
import com.tyron.picedit.api.editor.SyntaxHighlighter;

/**
 * Factory interface for language services.
 */
public interface LanguageSupport {

    /**
     * @return a stable identifier such as {@code "pic"}.
     */
    String getId();

    /**
     * @return true if this support handles the given file (e.g. endsWith(".pic"))
     */
    boolean canHandle(String fileName);

    /**
     * Creates a highlighter using the configured highlight level.
     */
    SyntaxHighlighter createHighlighter();

    /**
     * Creates an indenter using the configured indentation unit.
     *
     * Returning {@code null} means indentation is not supported for this language.
     */
    default Indenter createIndenter() {
        return null;
    }
}
