package com.fotogeo.logging;

import com.fotogeo.config.ConfigService;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides a shared logger configuration for the application.
 */
public final class AppLogger {
    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        ConfigService config = ConfigService.getInstance();
        Logger logger = Logger.getLogger("com.fotogeo.PhotoGeoExporter");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() != null && logger.isLoggable(Level.FINE)) {
                    line += "  caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(config.isDebug() ? Level.FINE : Level.INFO);

        config.getLogFile().ifPresent(file -> installFileHandler(logger, file, formatter));
        return logger;
    }

    private static void installFileHandler(Logger logger, Path file, Formatter formatter) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            FileHandler fileHandler = new FileHandler(file.toString(), true);
            fileHandler.setEncoding(UTF_8.name());
            fileHandler.setFormatter(formatter);
            fileHandler.setLevel(Level.ALL);
            logger.addHandler(fileHandler);
        } catch (Exception ex) {
            logger.warning("Failed to initialize file logging at " + file + ": " + ex.getMessage());
        }
    }
}
