package com.fotogeo.core.export;

import com.fotogeo.core.fs.OutputNames;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything a renderer needs besides the records: where to write and how to name things.
 */
public record ExportContext(String folderName, Path outputDirectory, OutputNames names, ExportSettings settings) {

    public ExportContext {
        Objects.requireNonNull(folderName, "folderName");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(names, "names");
        Objects.requireNonNull(settings, "settings");
    }

    public static ExportContext forFolder(Path photoFolder, Path outputDirectory, ExportSettings settings) {
        Path name = photoFolder.toAbsolutePath().normalize().getFileName();
        return new ExportContext(
            name == null ? photoFolder.toString() : name.toString(),
            outputDirectory,
            OutputNames.forFolder(photoFolder),
            settings
        );
    }

    public Path target(ExportFormat format) {
        return outputDirectory.resolve(format.fileName(names));
    }
}
