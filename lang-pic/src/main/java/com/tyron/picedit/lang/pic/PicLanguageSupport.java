package com.tyron.picedit.lang.pic;

import com.tyron.picedit.api.editor.Indenter;
import com.tyron.picedit.api.editor.SyntaxHighlighter;
import com.tyron.picedit.api.language.LanguageSupport;
import com.tyron.picedit.core.config.EditorOptions;
import com.tyron.picedit.core.highlight.HighlightEngine;
import com.tyron.picedit.core.highlight.HighlightLevels;
import com.tyron.picedit.core.indent.IndentEngine;
import com.tyron.picedit.lang.pic.editor.PicIndenter;
import com.tyron.picedit.lang.pic.editor.PicSyntaxHighlighter;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Objects;

public class PicLanguageSupport implements LanguageSupport {

    private final PicLanguage language;
    private final EditorOptions options;

    public PicLanguageSupport(@NotNull EditorOptions options) {
        this(PicLanguage.getInstance(), options);
    }

    /**
     * Uses the default options, overridden by {@code picedit.*} system properties.
     */
    public PicLanguageSupport() {
        this(EditorOptions.defaults().withOverrides(System.getProperties()));
    }

    PicLanguageSupport(@NotNull PicLanguage language, @NotNull EditorOptions options) {
        this.language = Objects.requireNonNull(language, "language");
        this.options = Objects.requireNonNull(options, "options");
    }

    public EditorOptions getOptions() {
        return options;
    }

    @Override
    public String getId() {
        return PicLanguage.ID;
    }

    @Override
    public boolean canHandle(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(PicLanguage.FILE_EXTENSION);
    }

    @Override
    public SyntaxHighlighter createHighlighter() {
        return new PicSyntaxHighlighter(new HighlightEngine(language.getHighlightRules()),
                HighlightLevels.upTo(options.highlightLevel()));
    }

    @Override
    public Indenter createIndenter() {
        return new PicIndenter(new IndentEngine(language.getIndentRules(), options.tabWidth()), options.indentUnit());
    }
}
