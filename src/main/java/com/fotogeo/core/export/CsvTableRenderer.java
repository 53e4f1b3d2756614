package com.fotogeo.core.export;

import com.fotogeo.core.fs.AtomicFileWriter;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.logging.AppLogger;
import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Flat CSV with one row per record, including records without coordinates. Written as UTF-8 with a BOM so
 * spreadsheet programs detect the encoding.
 */
public final class CsvTableRenderer implements ExportRenderer {
    private static final Logger LOGGER = AppLogger.get();

    static final char BOM = '\uFEFF';

    @Override
    public ExportFormat format() {
        return ExportFormat.CSV;
    }

    @Override
    public RenderResult render(List<ImageRecord> records, ExportContext context) throws IOException {
        Path target = context.target(format());
        AtomicFileWriter.write(target, out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            writer.write(BOM);
            try (CSVWriter csv = new CSVWriter(writer)) {
                csv.writeNext(TableColumns.headers().toArray(String[]::new));
                for (ImageRecord record : records) {
                    csv.writeNext(TableRowFormatter.format(record).toArray(String[]::new));
                }
            }
        });
        LOGGER.info("CSV saved: " + target + " (" + records.size() + " row(s))");
        return new RenderResult(format(), target, records.size(), List.of());
    }
}
