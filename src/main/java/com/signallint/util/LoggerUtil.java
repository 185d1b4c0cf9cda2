package com.signallint.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Configures java.util.logging for the linter and hands out loggers.
 * <p>
 * The classpath {@code /logging.properties} wins when present. Without it, console and file handlers
 * are installed; the file defaults to {@code signal-lint.log} and can be moved with the
 * {@value #LOG_FILE_PROPERTY} system property, or turned off by setting it to {@code none}.
 */
public class LoggerUtil {
    public static final String LOG_FILE_PROPERTY = "signallint.log.file";

    private static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    private static final String DEFAULT_LOG_FILE = "signal-lint.log";
    private static final String BASE_PACKAGE = "com.signallint";

    private static final Logger rootLogger = Logger.getLogger("");
    private static final Logger linterLogger = Logger.getLogger(BASE_PACKAGE);
    private static volatile boolean initialized = false;

    private LoggerUtil() {
    }

    public static synchronized void initialize() {
        if (initialized) {
            return;
        }
        initialized = true;

        try (InputStream config = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
                return;
            }
        } catch (IOException e) {
            System.err.println("Could not read " + LOG_CONFIG_RESOURCE + ": " + e.getMessage());
        }
        _installHandlers(System.getProperty(LOG_FILE_PROPERTY, DEFAULT_LOG_FILE));
    }

    private static void _installHandlers(String logFile) {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(Level.WARNING);
        console.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(console);

        if (!"none".equalsIgnoreCase(logFile)) {
            try {
                FileHandler file = new FileHandler(logFile, true);
                file.setLevel(Level.ALL);
                file.setFormatter(new SimpleFormatter());
                rootLogger.addHandler(file);
            } catch (IOException e) {
                System.err.println("Logging to console only, cannot open " + logFile + ": " + e.getMessage());
            }
        }
        linterLogger.setLevel(Level.INFO);
    }

    /**
     * Sets the level of console output; {@code --verbose} lowers it to FINE.
     */
    public static synchronized void setConsoleLevel(Level level) {
        initialize();
        Level current = linterLogger.getLevel();
        if (current == null || current.intValue() > level.intValue()) {
            linterLogger.setLevel(level);
        }
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes and closes every handler, typically right before the process exits.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }
}
