package com.fotogeo.core.update;

import com.fotogeo.core.exif.ImageTagWriter;
import com.fotogeo.core.exif.JpegExifTagWriter;
import com.fotogeo.core.exif.MetadataExtractor;
import com.fotogeo.core.exif.UnreadableImageException;
import com.fotogeo.core.exif.WriteFailedException;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.model.SkippedItem;
import com.fotogeo.core.model.UpdateRow;
import com.fotogeo.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Writes edited custom names and descriptions back into the photos. Each row is matched to a file by exact
 * name; rows that cannot be applied are reported and never stop the batch. A value is only written when it
 * differs from the tag already in the photo, compared after stripping surrounding whitespace.
 */
public final class MetadataUpdater {
    private static final Logger LOGGER = AppLogger.get();

    private final ImageTagWriter tagWriter;
    private final MetadataExtractor extractor;

    public MetadataUpdater() {
        this(new JpegExifTagWriter());
    }

    public MetadataUpdater(ImageTagWriter tagWriter) {
        this(tagWriter, new MetadataExtractor());
    }

    public MetadataUpdater(ImageTagWriter tagWriter, MetadataExtractor extractor) {
        this.tagWriter = Objects.requireNonNull(tagWriter, "tagWriter");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /**
     * Reads {@code table} and applies it to the photos in {@code sourceDirectory}.
     *
     * @throws IOException when the table cannot be opened or has no file-name column
     */
    public UpdateReport applyTable(Path table, Path sourceDirectory) throws IOException {
        List<UpdateRow> rows = new EditedTableReader().read(table);
        return apply(rows, sourceDirectory);
    }

    public UpdateReport apply(List<UpdateRow> rows, Path sourceDirectory) throws IOException {
        SourceFileIndex index = SourceFileIndex.of(sourceDirectory);
        Map<String, Long> occurrences = rows.stream()
            .collect(Collectors.groupingBy(UpdateRow::filename, Collectors.counting()));

        List<RowOutcome> outcomes = new ArrayList<>();
        for (UpdateRow row : rows) {
            outcomes.add(applyRow(row, index, occurrences));
        }

        int updated = 0;
        int unchanged = 0;
        List<SkippedItem> skipped = new ArrayList<>();
        for (RowOutcome outcome : outcomes) {
            if (outcome.isUpdated()) {
                updated++;
            } else if (outcome.isSkipped()) {
                skipped.add(new SkippedItem(outcome.filename(), "row " + outcome.rowNumber() + ": " + outcome.reason()));
            } else {
                unchanged++;
            }
        }
        LOGGER.info("Metadata update finished: " + updated + " photo(s) updated, " + unchanged + " unchanged, "
            + skipped.size() + " row(s) skipped");
        return new UpdateReport(updated, skipped, outcomes);
    }

    private RowOutcome applyRow(UpdateRow row, SourceFileIndex index, Map<String, Long> occurrences) {
        String filename = row.filename();
        if (row.customNameEdited() == null && row.descriptionEdited() == null) {
            return new RowOutcome(row.rowNumber(), filename, RowOutcome.Status.NO_EDITABLE_COLUMNS,
                "no editable columns (NomePersonalizado, Descricao) in the table");
        }
        if (occurrences.getOrDefault(filename, 0L) > 1) {
            LOGGER.warning("Row " + row.rowNumber() + ": " + filename + " appears in several rows, not updated");
            return new RowOutcome(row.rowNumber(), filename, RowOutcome.Status.AMBIGUOUS,
                "file name appears in " + occurrences.get(filename) + " rows");
        }

        Path photo;
        try {
            photo = index.resolve(filename);
        } catch (UnmatchedRowException ex) {
            LOGGER.warning("Row " + row.rowNumber() + ": " + ex.getMessage());
            return new RowOutcome(row.rowNumber(), filename, RowOutcome.Status.UNMATCHED, ex.getMessage());
        }

        ImageRecord current;
        try {
            current = extractor.extract(photo);
        } catch (UnreadableImageException ex) {
            LOGGER.warning("Row " + row.rowNumber() + ": " + filename + " not updated: " + ex.getMessage());
            return new RowOutcome(row.rowNumber(), filename, RowOutcome.Status.WRITE_FAILED, ex.getMessage());
        }
        String description = changedValue(row.descriptionEdited(), current.description());
        String customName = changedValue(row.customNameEdited(), current.customName());
        if (description == null && customName == null) {
            LOGGER.fine(() -> filename + " already matches the table");
            return RowOutcome.unchanged(row.rowNumber(), filename);
        }

        try {
            tagWriter.writeTags(photo, description, customName);
            LOGGER.fine(() -> "Updated " + filename);
            return RowOutcome.updated(row.rowNumber(), filename);
        } catch (WriteFailedException ex) {
            LOGGER.warning("Row " + row.rowNumber() + ": " + filename + " not updated: " + ex.getMessage());
            return new RowOutcome(row.rowNumber(), filename, RowOutcome.Status.WRITE_FAILED, ex.getMessage());
        }
    }

    /**
     * Returns {@code edited} when it differs from the stored tag, otherwise {@code null} so the tag is kept as is.
     * An absent tag compares equal to an empty cell.
     */
    static String changedValue(String edited, Optional<String> stored) {
        if (edited == null) {
            return null;
        }
        String current = stored.map(String::strip).orElse("");
        return edited.strip().equals(current) ? null : edited;
    }
}
