package com.fotogeo.core.exif;

import com.fotogeo.core.model.ImageRecord;

import java.util.List;

/**
 * Counters describing one extraction run.
 */
public record ExtractionSummary(int filesFound,
                                int records,
                                int unreadable,
                                int withCoordinates,
                                int withoutCoordinates,
                                int projectionFailures,
                                int withTimestamp,
                                int withDescription,
                                int withCustomName) {

    static ExtractionSummary of(int filesFound, List<ImageRecord> records, int unreadable) {
        int withCoordinates = 0;
        int projectionFailures = 0;
        int withTimestamp = 0;
        int withDescription = 0;
        int withCustomName = 0;
        for (ImageRecord record : records) {
            if (record.hasCoordinates()) {
                withCoordinates++;
                if (!record.isPlaceable()) {
                    projectionFailures++;
                }
            }
            if (record.captureTimestamp().isPresent()) {
                withTimestamp++;
            }
            if (record.description().filter(s -> !s.isBlank()).isPresent()) {
                withDescription++;
            }
            if (record.customName().filter(s -> !s.isBlank()).isPresent()) {
                withCustomName++;
            }
        }
        return new ExtractionSummary(filesFound, records.size(), unreadable, withCoordinates,
            records.size() - withCoordinates, projectionFailures, withTimestamp, withDescription, withCustomName);
    }

    public String describe() {
        return ("%d file(s) found, %d processed, %d unreadable; %d with GPS (%d UTM failures), %d without GPS; "
            + "%d with date, %d with description, %d with custom name").formatted(
            filesFound, records, unreadable, withCoordinates, projectionFailures, withoutCoordinates,
            withTimestamp, withDescription, withCustomName);
    }
}
