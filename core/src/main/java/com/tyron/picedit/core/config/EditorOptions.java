package com.tyron.picedit.core.config;

import com.tyron.picedit.core.highlight.HighlightLevels;
import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * User-facing settings of the engines.
 *
 * <pre>
 * # picedit.yaml
 * indentUnit: 2
 * tabWidth: 8
 * highlightLevel: 3
 * </pre>
 *
 * System properties {@code picedit.indentUnit}, {@code picedit.tabWidth} and
 * {@code picedit.highlightLevel} take precedence over the file. Invalid values are logged
 * and replaced by the default.
 */
public record EditorOptions(int indentUnit, int tabWidth, int highlightLevel) {

    public static final String FILE_NAME = "picedit.yaml";
    public static final String PROPERTY_PREFIX = "picedit.";

    public static final int DEFAULT_INDENT_UNIT = 2;
    public static final int DEFAULT_TAB_WIDTH = 8;
    public static final int DEFAULT_HIGHLIGHT_LEVEL = 3;

    public static final int MAX_INDENT_UNIT = 16;
    public static final int MAX_TAB_WIDTH = 16;

    private static final Logger LOG = Logger.getLogger(EditorOptions.class.getName());

    public EditorOptions {
        if (indentUnit <= 0 || indentUnit > MAX_INDENT_UNIT) {
            throw new IllegalArgumentException("indentUnit must be in 1.." + MAX_INDENT_UNIT + ", got " + indentUnit);
        }
        if (tabWidth <= 0 || tabWidth > MAX_TAB_WIDTH) {
            throw new IllegalArgumentException("tabWidth must be in 1.." + MAX_TAB_WIDTH + ", got " + tabWidth);
        }
        if (highlightLevel < HighlightLevels.MIN_LEVEL || highlightLevel > HighlightLevels.MAX_LEVEL) {
            throw new IllegalArgumentException("highlightLevel out of range: " + highlightLevel);
        }
    }

    public static EditorOptions defaults() {
        return new EditorOptions(DEFAULT_INDENT_UNIT, DEFAULT_TAB_WIDTH, DEFAULT_HIGHLIGHT_LEVEL);
    }

    /**
     * Reads {@link #FILE_NAME} from {@code directory} if present, then applies system properties.
     */
    public static EditorOptions load(@NotNull Path directory) {
        Objects.requireNonNull(directory, "directory");
        EditorOptions options = defaults();
        Path file = directory.resolve(FILE_NAME);
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                options = options.merge(in);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to read " + file + ", using defaults", e);
            }
        }
        return options.withOverrides(System.getProperties());
    }

    /**
     * @return these options with every key present in the YAML document replaced.
     */
    public EditorOptions merge(@NotNull InputStream yaml) {
        Objects.requireNonNull(yaml, "yaml");
        Object doc;
        try {
            doc = new Yaml().load(yaml);
        } catch (YAMLException e) {
            LOG.log(Level.WARNING, "Malformed " + FILE_NAME + ", keeping current options", e);
            return this;
        }
        if (doc == null) {
            return this;
        }
        if (!(doc instanceof Map<?, ?> map)) {
            LOG.warning(FILE_NAME + " must be a mapping, keeping current options");
            return this;
        }
        return new EditorOptions(
                intValue(map.get("indentUnit"), "indentUnit", indentUnit, 1, MAX_INDENT_UNIT),
                intValue(map.get("tabWidth"), "tabWidth", tabWidth, 1, MAX_TAB_WIDTH),
                intValue(map.get("highlightLevel"), "highlightLevel", highlightLevel,
                        HighlightLevels.MIN_LEVEL, HighlightLevels.MAX_LEVEL));
    }

    public EditorOptions withOverrides(@NotNull Properties properties) {
        return new EditorOptions(
                intValue(properties.getProperty(PROPERTY_PREFIX + "indentUnit"), "indentUnit", indentUnit, 1, MAX_INDENT_UNIT),
                intValue(properties.getProperty(PROPERTY_PREFIX + "tabWidth"), "tabWidth", tabWidth, 1, MAX_TAB_WIDTH),
                intValue(properties.getProperty(PROPERTY_PREFIX + "highlightLevel"), "highlightLevel", highlightLevel,
                        HighlightLevels.MIN_LEVEL, HighlightLevels.MAX_LEVEL));
    }

    public EditorOptions withIndentUnit(int indentUnit) {
        return new EditorOptions(indentUnit, tabWidth, highlightLevel);
    }

    public EditorOptions withHighlightLevel(int highlightLevel) {
        return new EditorOptions(indentUnit, tabWidth, highlightLevel);
    }

    private static int intValue(Object raw, String key, int fallback, int min, int max) {
        if (raw == null) {
            return fallback;
        }
        int value;
        if (raw instanceof Integer i) {
            value = i;
        } else {
            try {
                value = Integer.parseInt(String.valueOf(raw).trim());
            } catch (NumberFormatException e) {
                LOG.warning("Ignoring non-numeric " + key + "='" + raw + "'");
                return fallback;
            }
        }
        if (value < min || value > max) {
            LOG.warning("Ignoring out-of-range " + key + "=" + value);
            return fallback;
        }
        return value;
    }
}
