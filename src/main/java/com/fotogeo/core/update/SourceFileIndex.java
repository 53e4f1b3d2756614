package com.fotogeo.core.update;

import com.fotogeo.core.fs.PhotoDiscoveryService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * File names present in the photo folder, matched exactly and case-sensitively, even on file systems that
 * would resolve a differently-cased name.
 */
final class SourceFileIndex {
    private final Map<String, Path> filesByName;

    private SourceFileIndex(Map<String, Path> filesByName) {
        this.filesByName = filesByName;
    }

    static SourceFileIndex of(Path directory) throws IOException {
        PhotoDiscoveryService.requireDirectory(directory);
        Map<String, Path> files = new HashMap<>();
        try (Stream<Path> stream = Files.list(directory)) {
            stream.filter(Files::isRegularFile)
                .forEach(path -> files.put(path.getFileName().toString(), path));
        }
        return new SourceFileIndex(files);
    }

    Path resolve(String filename) throws UnmatchedRowException {
        Path path = filesByName.get(filename);
        if (path == null) {
            throw new UnmatchedRowException(filename);
        }
        return path;
    }
}
