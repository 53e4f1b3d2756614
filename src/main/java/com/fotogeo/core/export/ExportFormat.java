package com.fotogeo.core.export;

import com.fotogeo.core.fs.OutputNames;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Artifact kinds the pipeline can produce, with the keyword accepted on the command line.
 */
public enum ExportFormat {
    KMZ("kmz", true),
    SIMPLE_KML("kml", true),
    CSV("csv", false),
    EXCEL("excel", false);

    private final String keyword;
    private final boolean mapOverlay;

    ExportFormat(String keyword, boolean mapOverlay) {
        this.keyword = keyword;
        this.mapOverlay = mapOverlay;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Map overlays only contain records with a projected coordinate.
     */
    public boolean isMapOverlay() {
        return mapOverlay;
    }

    public String fileName(OutputNames names) {
        return switch (this) {
            case KMZ -> names.kmz();
            case SIMPLE_KML -> names.simpleKml();
            case CSV -> names.csv();
            case EXCEL -> names.excel();
        };
    }

    /**
     * Parses a keyword; {@code all} expands to every format.
     */
    public static Set<ExportFormat> parse(String keyword) {
        String normalized = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("all")) {
            return EnumSet.allOf(ExportFormat.class);
        }
        for (ExportFormat format : values()) {
            if (format.keyword.equals(normalized)) {
                return EnumSet.of(format);
            }
        }
        throw new IllegalArgumentException("Unknown export format: " + keyword);
    }
}
