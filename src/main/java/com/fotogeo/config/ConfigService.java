package com.fotogeo.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Central entry point for resolving configuration values with overrides and persisted preferences.
 * <p>
 * Every key is looked up as the system property {@code fotogeo.<key>}, then the environment variable
 * {@code FOTOGEO_<KEY>} (dots become underscores), then {@code fotogeo.properties} on the classpath.
 */
public final class ConfigService {
    static final String PROPERTIES_RESOURCE = "fotogeo.properties";
    private static final String PREFIX = "fotogeo.";

    private static final String PREF_KEY_PHOTO_DIR = "photo.dir";
    private static final String PREF_KEY_TABLE = "edited.table";

    private static final int DEFAULT_KMZ_IMAGE_WIDTH = 400;
    private static final double DEFAULT_KMZ_IMAGE_QUALITY = 0.85;
    private static final int DEFAULT_EXCEL_THUMBNAIL_WIDTH = 250;
    private static final double DEFAULT_EXCEL_IMAGE_QUALITY = 0.90;

    private static final ConfigService INSTANCE = new ConfigService(
        PreferencesStore.global(),
        loadFileProperties(),
        System::getenv
    );

    private final PreferencesStore preferences;
    private final Properties fileProperties;
    private final Function<String, String> environment;

    ConfigService(PreferencesStore preferences, Properties fileProperties, Function<String, String> environment) {
        this.preferences = preferences;
        this.fileProperties = fileProperties == null ? new Properties() : fileProperties;
        this.environment = environment == null ? key -> null : environment;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public int getKmzImageWidth() {
        return parseInt(lookup("kmz.imageWidth"), DEFAULT_KMZ_IMAGE_WIDTH);
    }

    public double getKmzImageQuality() {
        return parseQuality(lookup("kmz.imageQuality"), DEFAULT_KMZ_IMAGE_QUALITY);
    }

    public int getExcelThumbnailWidth() {
        return parseInt(lookup("excel.thumbnailWidth"), DEFAULT_EXCEL_THUMBNAIL_WIDTH);
    }

    public double getExcelImageQuality() {
        return parseQuality(lookup("excel.imageQuality"), DEFAULT_EXCEL_IMAGE_QUALITY);
    }

    /**
     * Directory that receives generated artifacts, or empty to write next to the photos.
     */
    public Optional<Path> getOutputDirectory() {
        return Optional.ofNullable(lookup("output.dir")).map(Path::of);
    }

    public SortOrder getSortOrder() {
        return SortOrder.parse(lookup("sort"));
    }

    public boolean isDebug() {
        return Boolean.parseBoolean(lookup("debug"));
    }

    public Optional<Path> getLogFile() {
        return Optional.ofNullable(lookup("log.file")).map(Path::of);
    }

    public Optional<Path> getLastPhotoDirectory() {
        return preferences.getPath(PREF_KEY_PHOTO_DIR);
    }

    public void setLastPhotoDirectory(Path directory) {
        preferences.putPath(PREF_KEY_PHOTO_DIR, directory);
    }

    public Optional<Path> getLastEditedTable() {
        return preferences.getPath(PREF_KEY_TABLE);
    }

    public void setLastEditedTable(Path table) {
        preferences.putPath(PREF_KEY_TABLE, table);
    }

    /**
     * Resolves a raw value for {@code key} without applying defaults.
     */
    public String lookup(String key) {
        return firstNonBlank(
            System.getProperty(PREFIX + key),
            environment.apply(toEnvironmentName(key)),
            fileProperties.getProperty(key)
        );
    }

    static String toEnvironmentName(String key) {
        return ("FOTOGEO_" + key.replace('.', '_')).toUpperCase(Locale.ROOT);
    }

    private static Properties loadFileProperties() {
        Properties props = new Properties();
        try (InputStream stream = ConfigService.class
            .getClassLoader()
            .getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ignored) {
            // ignore malformed property file and fall back to env/system props
        }
        return props;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static int parseInt(String raw, int fallback) {
        try {
            return raw == null ? fallback : Math.max(1, Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double parseQuality(String raw, double fallback) {
        try {
            if (raw == null) {
                return fallback;
            }
            double value = Double.parseDouble(raw);
            return (value > 0 && value <= 1) ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    /**
     * Ordering applied to extracted records before export.
     */
    public enum SortOrder {
        /** Capture time ascending, undated photos last, ties broken by file name. */
        DATE,
        FILENAME;

        static SortOrder parse(String raw) {
            if (raw != null && raw.trim().equalsIgnoreCase("filename")) {
                return FILENAME;
            }
            return DATE;
        }
    }
}
