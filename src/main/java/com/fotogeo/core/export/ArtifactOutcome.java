package com.fotogeo.core.export;

import java.nio.file.Path;
import java.util.Optional;

/**
 * What happened to one requested format: the written file, or the error that prevented it.
 */
public record ArtifactOutcome(ExportFormat format, Path path, int entries, String error) {

    static ArtifactOutcome written(RenderResult result) {
        return new ArtifactOutcome(result.format(), result.artifact(), result.entries(), null);
    }

    static ArtifactOutcome failed(ExportFormat format, String error) {
        return new ArtifactOutcome(format, null, 0, error);
    }

    public boolean succeeded() {
        return path != null;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
