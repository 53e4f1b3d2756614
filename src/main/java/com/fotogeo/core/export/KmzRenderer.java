package com.fotogeo.core.export;

import com.fotogeo.core.fs.AtomicFileWriter;
import com.fotogeo.core.fs.OutputNames;
import com.fotogeo.core.image.OrientedThumbnailer;
import com.fotogeo.core.image.Thumbnail;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.title.TitleResolver;
import com.fotogeo.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Google Earth KMZ: {@code doc.kml} plus one upright, resized JPEG per placemark under {@code files/}.
 * A photo that cannot be decoded still gets its placemark, with a note instead of the picture.
 */
public final class KmzRenderer implements ExportRenderer {
    private static final Logger LOGGER = AppLogger.get();

    static final String DOC_ENTRY = "doc.kml";
    static final String ASSET_FOLDER = "files/";

    private final TitleResolver titleResolver;
    private final OrientedThumbnailer thumbnailer;

    public KmzRenderer(TitleResolver titleResolver, OrientedThumbnailer thumbnailer) {
        this.titleResolver = titleResolver;
        this.thumbnailer = thumbnailer;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.KMZ;
    }

    @Override
    public RenderResult render(List<ImageRecord> records, ExportContext context) throws IOException {
        ExportSettings settings = context.settings();
        List<RenderFailure> failures = new ArrayList<>();
        List<Entry> entries = new ArrayList<>();
        Map<String, byte[]> assets = new LinkedHashMap<>();

        int index = 0;
        for (ImageRecord record : records) {
            if (!record.isPlaceable()) {
                LOGGER.fine(() -> "KMZ: no UTM position for " + record.filename() + ", not placed");
                continue;
            }
            index++;
            String title = titleResolver.resolve(record);
            String description = PlacemarkDescriptionBuilder.build(record, title);
            try {
                Path source = record.source()
                    .orElseThrow(() -> new IOException("no source file"));
                Thumbnail thumbnail = thumbnailer.createThumbnail(
                    source, record.orientation(), settings.kmzImageWidth(), settings.kmzImageQuality());
                String asset = ASSET_FOLDER + assetName(index, record.filename());
                assets.put(asset, thumbnail.jpeg());
                description = PlacemarkDescriptionBuilder.withImage(description, asset, settings.kmzImageWidth());
            } catch (IOException | RuntimeException ex) {
                LOGGER.warning("KMZ: image of " + record.filename() + " not embedded: " + ex.getMessage());
                failures.add(new RenderFailure(format(), record.filename(), "image not embedded: " + ex.getMessage()));
                description = PlacemarkDescriptionBuilder.withoutImage(description);
            }
            entries.add(new Entry(record, title, description));
        }

        Path target = context.target(format());
        AtomicFileWriter.write(target, out -> {
            try (ZipOutputStream zip = new ZipOutputStream(out)) {
                zip.putNextEntry(new ZipEntry(DOC_ENTRY));
                try (KmlDocumentWriter kml = new KmlDocumentWriter(zip, "Coords " + context.folderName())) {
                    for (Entry entry : entries) {
                        kml.placemark(entry.record(), entry.title(), entry.description());
                    }
                }
                zip.closeEntry();
                for (Map.Entry<String, byte[]> asset : assets.entrySet()) {
                    zip.putNextEntry(new ZipEntry(asset.getKey()));
                    zip.write(asset.getValue());
                    zip.closeEntry();
                }
            }
        });
        LOGGER.info("KMZ saved: " + target + " (" + entries.size() + " point(s), " + assets.size() + " image(s))");
        return new RenderResult(format(), target, entries.size(), failures);
    }

    static String assetName(int index, String filename) {
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        return "%03d_%s.jpg".formatted(index, OutputNames.sanitize(stem));
    }

    private record Entry(ImageRecord record, String title, String description) {
    }
}
