package com.fotogeo.core.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates the photos directly inside a folder. Sub-folders are not descended into.
 */
public final class PhotoDiscoveryService {
    static final Set<String> PHOTO_EXTENSIONS = Set.of(".jpg", ".jpeg", ".tif", ".tiff", ".png");

    private static final Comparator<Path> NAME_ORDER = Comparator.comparing(p -> p.getFileName().toString());

    public List<Path> findPhotos(Path folder) {
        requireDirectory(folder);
        try (Stream<Path> stream = Files.list(folder)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(PhotoDiscoveryService::isPhoto)
                .sorted(NAME_ORDER)
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list " + folder, ex);
        }
    }

    public static boolean isPhoto(Path path) {
        return PHOTO_EXTENSIONS.contains(extensionOf(path));
    }

    public static boolean isJpeg(Path path) {
        String ext = extensionOf(path);
        return ext.equals(".jpg") || ext.equals(".jpeg");
    }

    /**
     * Lower-cased extension including the dot, or an empty string.
     */
    static String extensionOf(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot < 0 ? "" : s.substring(dot).toLowerCase(Locale.ROOT);
    }

    public static void requireDirectory(Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            throw new IllegalArgumentException(folder + " is not a directory");
        }
    }
}
