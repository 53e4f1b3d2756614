package com.fotogeo.core.export;

import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.model.ProjectedCoordinate;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Cell text for one record, in {@link TableColumns} order. Absent values become empty cells.
 */
public final class TableRowFormatter {
    static final DateTimeFormatter TABLE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TableRowFormatter() {
    }

    public static List<String> format(ImageRecord record) {
        ProjectedCoordinate utm = record.projected().orElse(null);
        List<String> cells = new ArrayList<>(TableColumns.values().length);
        cells.add(record.filename());
        cells.add(record.customName().orElse(""));
        cells.add(record.description().orElse(""));
        cells.add(record.latitude().map(TableRowFormatter::degrees).orElse(""));
        cells.add(record.longitude().map(TableRowFormatter::degrees).orElse(""));
        cells.add(utm == null ? "" : meters(utm.easting()));
        cells.add(utm == null ? "" : meters(utm.northing()));
        cells.add(utm == null ? "" : Integer.toString(utm.zone()));
        cells.add(utm == null ? "" : String.valueOf(utm.hemisphere()));
        cells.add(record.captureTimestamp().map(TABLE_TIMESTAMP::format).orElse(""));
        return cells;
    }

    static String degrees(double value) {
        return String.format(Locale.ROOT, "%.7f", value);
    }

    static String meters(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
