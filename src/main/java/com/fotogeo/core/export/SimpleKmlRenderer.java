package com.fotogeo.core.export;

import com.fotogeo.core.fs.AtomicFileWriter;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.title.TitleResolver;
import com.fotogeo.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Plain KML with the same placemarks as the KMZ but no embedded images, for viewers that do not read KMZ.
 */
public final class SimpleKmlRenderer implements ExportRenderer {
    private static final Logger LOGGER = AppLogger.get();

    private final TitleResolver titleResolver;

    public SimpleKmlRenderer(TitleResolver titleResolver) {
        this.titleResolver = titleResolver;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.SIMPLE_KML;
    }

    @Override
    public RenderResult render(List<ImageRecord> records, ExportContext context) throws IOException {
        Path target = context.target(format());
        int[] written = {0};
        AtomicFileWriter.write(target, out -> {
            try (KmlDocumentWriter kml = new KmlDocumentWriter(out, "Coords " + context.folderName() + " (Simple)")) {
                for (ImageRecord record : records) {
                    if (!record.isPlaceable()) {
                        LOGGER.fine(() -> "KML: no UTM position for " + record.filename() + ", not placed");
                        continue;
                    }
                    String title = titleResolver.resolve(record);
                    kml.placemark(record, title, PlacemarkDescriptionBuilder.build(record, title));
                    written[0]++;
                }
            }
        });
        LOGGER.info("Simple KML saved: " + target + " (" + written[0] + " point(s))");
        return new RenderResult(format(), target, written[0], List.of());
    }
}
