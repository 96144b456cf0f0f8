package com.solfmt.util;

import java.io.InputStream;
import java.util.logging.*;

/**
 * Configures java.util.logging for the formatter. Log records go to stderr so that stdout only
 * carries command output.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;

    /**
     * Initializes logging from the bundled {@code /logging.properties}, or with a plain console
     * handler when the resource is missing.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (Exception e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            configureBasicLogging();
            initialized = true;
        }
    }

    private static void configureBasicLogging() {
        // Reset existing handlers
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.ALL);
    }

    /**
     * Sets the console logging level. {@code --verbose} lowers it to {@link Level#FINE}.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;

        if (!initialized) {
            initialize();
        }
        if (rootLogger.getLevel() == null || rootLogger.getLevel().intValue() > level.intValue()) {
            rootLogger.setLevel(level);
        }
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    public static synchronized Level getConsoleLevel() {
        return consoleLevel;
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    /**
     * Gets a logger for a specific name.
     */
    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Flushes and closes all handlers.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }
}
