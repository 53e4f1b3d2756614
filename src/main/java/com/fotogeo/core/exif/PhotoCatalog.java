package com.fotogeo.core.exif;

import com.fotogeo.config.ConfigService.SortOrder;
import com.fotogeo.core.fs.PhotoDiscoveryService;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.model.SkippedItem;
import com.fotogeo.logging.AppLogger;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extracts every photo in a folder, one file at a time, and orders the resulting records.
 * An unreadable file becomes a skip entry; it never stops the scan.
 */
public final class PhotoCatalog {
    private static final Logger LOGGER = AppLogger.get();

    static final Comparator<ImageRecord> BY_FILENAME = Comparator.comparing(ImageRecord::filename);
    static final Comparator<ImageRecord> BY_DATE = Comparator
        .comparing((ImageRecord r) -> r.captureTimestamp().orElse(null),
            Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
        .thenComparing(BY_FILENAME);

    private final PhotoDiscoveryService discoveryService;
    private final MetadataExtractor extractor;

    public PhotoCatalog() {
        this(new PhotoDiscoveryService(), new MetadataExtractor());
    }

    public PhotoCatalog(PhotoDiscoveryService discoveryService, MetadataExtractor extractor) {
        this.discoveryService = Objects.requireNonNull(discoveryService, "discoveryService");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public ExtractionBatch scan(Path folder, SortOrder sortOrder) {
        List<Path> photos = discoveryService.findPhotos(folder);
        LOGGER.info("Scanning " + photos.size() + " photo(s) in " + folder);

        List<ImageRecord> records = new ArrayList<>();
        List<SkippedItem> skipped = new ArrayList<>();
        for (Path photo : photos) {
            String name = photo.getFileName().toString();
            try {
                ImageRecord record = extractor.extract(photo);
                records.add(record);
                LOGGER.fine(() -> "Extracted " + record);
            } catch (UnreadableImageException ex) {
                LOGGER.warning("Skipping " + name + ": " + ex.getMessage());
                skipped.add(new SkippedItem(name, ex.getMessage()));
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Skipping " + name + ": metadata reader failed", ex);
                skipped.add(new SkippedItem(name, "metadata reader failed: " + ex));
            }
        }

        records.sort(sortOrder == SortOrder.FILENAME ? BY_FILENAME : BY_DATE);
        ExtractionSummary summary = ExtractionSummary.of(photos.size(), records, skipped.size());
        LOGGER.info(summary.describe());
        return new ExtractionBatch(folder, records, skipped, summary);
    }
}
