package com.tyron.picedit.testFramework;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Test-only logging setup.
 *
 * Controls java.util.logging output via system property:
 * - picedit.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 */
public final class TestLogging {

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty("picedit.test.logLevel", "INFO"));

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
            if (h instanceof ConsoleHandler) {
                h.setFormatter(new CompactFormatter());
            }
        }
    }

    /**
     * Starts recording everything logged by {@code owner}'s logger until the returned
     * capture is closed.
     */
    public static Capture capture(Class<?> owner) {
        return new Capture(Logger.getLogger(owner.getName()));
    }

    public static final class Capture extends Handler implements AutoCloseable {

        private final Logger logger;
        private final Level previousLevel;
        private final List<LogRecord> records = Collections.synchronizedList(new ArrayList<>());

        private Capture(Logger logger) {
            this.logger = logger;
            this.previousLevel = logger.getLevel();
            setLevel(Level.ALL);
            logger.setLevel(Level.ALL);
            logger.addHandler(this);
        }

        public List<LogRecord> records() {
            synchronized (records) {
                return List.copyOf(records);
            }
        }

        public boolean contains(Level level, String fragment) {
            for (LogRecord r : records()) {
                if (r.getLevel().equals(level) && r.getMessage() != null && r.getMessage().contains(fragment)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            logger.removeHandler(this);
            logger.setLevel(previousLevel);
        }
    }

    private static final class CompactFormatter extends Formatter {

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(96);
            out.append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName()))
                    .append(' ')
                    .append(simpleName(record.getLoggerName()))
                    .append(" - ")
                    .append(formatMessage(record))
                    .append('\n');

            Throwable t = record.getThrown();
            if (t != null) {
                StringWriter sw = new StringWriter();
                t.printStackTrace(new PrintWriter(sw));
                out.append(sw);
            }
            return out.toString();
        }

        private static String simpleName(String loggerName) {
            if (loggerName == null || loggerName.isBlank()) return "root";
            return loggerName.substring(loggerName.lastIndexOf('.') + 1);
        }
    }

    private static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return Level.INFO;
        }
    }
}
