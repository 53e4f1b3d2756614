package com.fotogeo.core.fs;

import com.fotogeo.logging.AppLogger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a file through a temporary sibling and moves it into place once the content is complete,
 * so readers never observe a half-written artifact.
 */
public final class AtomicFileWriter {
    private static final Logger LOGGER = AppLogger.get();

    @FunctionalInterface
    public interface OutputAction {
        void writeTo(OutputStream out) throws IOException;
    }

    private AtomicFileWriter() {
    }

    public static Path write(Path target, OutputAction action) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        boolean moved = false;
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                action.writeTo(out);
            }
            moveIntoPlace(temp, target);
            moved = true;
            return target;
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Replaces {@code target} with {@code source}, atomically where the file system allows it.
     */
    public static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.fine(() -> "Atomic move not supported for " + target + ", falling back to replace");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            LOGGER.log(Level.FINE, "Could not delete temporary file " + path, ex);
        }
    }
}
