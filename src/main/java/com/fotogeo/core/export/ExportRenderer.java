package com.fotogeo.core.export;

import com.fotogeo.core.model.ImageRecord;

import java.io.IOException;
import java.util.List;

/**
 * Turns an ordered list of records into one artifact. Records are rendered in the order given.
 * <p>
 * Per-record problems are reported in {@link RenderResult#failures()}; an exception means no artifact was
 * produced for this format.
 */
public interface ExportRenderer {

    ExportFormat format();

    RenderResult render(List<ImageRecord> records, ExportContext context) throws IOException;
}
