package com.fotogeo.core.exif;

import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.model.SkippedItem;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of scanning a photo folder: ordered records, the files that could not be read, and counters.
 */
public record ExtractionBatch(Path sourceDirectory,
                              List<ImageRecord> records,
                              List<SkippedItem> skipped,
                              ExtractionSummary summary) {

    public ExtractionBatch {
        records = List.copyOf(records);
        skipped = List.copyOf(skipped);
    }
}
