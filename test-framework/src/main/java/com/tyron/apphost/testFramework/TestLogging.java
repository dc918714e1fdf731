package com.tyron.apphost.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Test-only logging setup.
 * <p>
 * Controls java.util.logging output of the {@code com.tyron.apphost} loggers via system property:
 * - apphost.test.logLevel=INFO|FINE|FINER|FINEST|WARNING|SEVERE
 * <p>
 * {@link #capture(Class)} collects the records of one logger so tests can assert on diagnostics.
 */
public final class TestLogging {

    public static final String LOG_LEVEL_PROPERTY = "apphost.test.logLevel";

    private static final String BASE_LOGGER = "com.tyron.apphost";

    // Strong reference, JUL only keeps loggers weakly.
    private static final Logger APPHOST = Logger.getLogger(BASE_LOGGER);

    private static volatile boolean configured;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LOG_LEVEL_PROPERTY, "INFO"));

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(new CompactTestLogFormatter());

        APPHOST.setUseParentHandlers(false);
        APPHOST.setLevel(level);
        APPHOST.addHandler(console);

        APPHOST.log(Level.INFO, "testLogging configured level=" + level.getName());
    }

    /**
     * Starts collecting every record the logger of {@code owner} publishes, at any level.
     * Close the capture to restore the logger.
     */
    public static LogCapture capture(Class<?> owner) {
        return new LogCapture(Logger.getLogger(owner.getName()));
    }

    public static final class LogCapture extends Handler implements AutoCloseable {

        private final Logger logger;
        private final Level previousLevel;
        private final List<LogRecord> records = new ArrayList<>();

        private LogCapture(Logger logger) {
            this.logger = logger;
            this.previousLevel = logger.getLevel();
            setLevel(Level.ALL);
            logger.setLevel(Level.ALL);
            logger.addHandler(this);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            records.add(record);
        }

        public synchronized List<LogRecord> getRecords() {
            return List.copyOf(records);
        }

        public synchronized List<String> getMessages(Level level) {
            List<String> out = new ArrayList<>();
            for (LogRecord r : records) {
                if (r.getLevel().equals(level)) {
                    out.add(r.getMessage());
                }
            }
            return out;
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

    private static final class CompactTestLogFormatter extends Formatter {

        private static final DateTimeFormatter TS = DateTimeFormatter
                .ofPattern("HH:mm:ss.SSS")
                .withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(128);
            out.append(TS.format(Instant.ofEpochMilli(record.getMillis()))).append(' ')
                    .append(String.format(Locale.ROOT, "%-7s", record.getLevel().getName())).append(' ')
                    .append(simpleName(record.getLoggerName())).append(" - ")
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
