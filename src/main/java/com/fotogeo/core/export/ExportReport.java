package com.fotogeo.core.export;

import java.util.List;

/**
 * Artifacts produced by one pipeline run plus every per-record or per-format failure.
 */
public record ExportReport(List<ArtifactOutcome> artifacts, List<RenderFailure> renderFailures) {

    public ExportReport {
        artifacts = List.copyOf(artifacts);
        renderFailures = List.copyOf(renderFailures);
    }

    public boolean allFormatsWritten() {
        return artifacts.stream().allMatch(ArtifactOutcome::succeeded);
    }
}
