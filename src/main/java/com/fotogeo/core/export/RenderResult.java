package com.fotogeo.core.export;

import java.nio.file.Path;
import java.util.List;

/**
 * Output of one renderer invocation.
 *
 * @param entries number of placemarks or rows written
 */
public record RenderResult(ExportFormat format, Path artifact, int entries, List<RenderFailure> failures) {

    public RenderResult {
        failures = List.copyOf(failures);
    }
}
