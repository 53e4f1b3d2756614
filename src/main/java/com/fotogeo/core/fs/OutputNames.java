package com.fotogeo.core.fs;

import java.nio.file.Path;

/**
 * File names of the artifacts produced for one photo folder.
 */
public final class OutputNames {
    static final int MAX_BASE_LENGTH = 100;
    private static final String PREFIX = "coordenadas_utm_";

    private final String baseName;

    private OutputNames(String baseName) {
        this.baseName = baseName;
    }

    public static OutputNames forFolder(Path photoFolder) {
        Path name = photoFolder.toAbsolutePath().normalize().getFileName();
        String folderName = name == null ? "root" : name.toString();
        return new OutputNames(sanitize(PREFIX + folderName));
    }

    public String baseName() {
        return baseName;
    }

    public String kmz() {
        return baseName + ".kmz";
    }

    public String simpleKml() {
        return baseName + "_simple.kml";
    }

    public String csv() {
        return baseName + ".csv";
    }

    public String excel() {
        return baseName + "_con_fotos.xlsx";
    }

    public String report() {
        return baseName + "_report.json";
    }

    public String updateReport() {
        return baseName + "_update_report.json";
    }

    /**
     * Removes characters Windows refuses in file names, turns spaces into underscores and caps the length.
     */
    public static String sanitize(String name) {
        String cleaned = name.replaceAll("[\\\\/*?:\"<>|]", "").replace(' ', '_').trim();
        if (cleaned.isEmpty()) {
            cleaned = "export";
        }
        return cleaned.length() > MAX_BASE_LENGTH ? cleaned.substring(0, MAX_BASE_LENGTH) : cleaned;
    }
}
