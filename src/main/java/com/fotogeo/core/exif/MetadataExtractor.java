package com.fotogeo.core.exif;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.StringValue;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.fotogeo.core.geo.ConversionException;
import com.fotogeo.core.geo.CoordinateConverter;
import com.fotogeo.core.geo.GeoPosition;
import com.fotogeo.core.model.ImageRecord;
import com.fotogeo.core.model.Orientation;
import com.fotogeo.logging.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads the EXIF tags of one photo and normalizes them into an {@link ImageRecord}. Never modifies the file.
 */
public class MetadataExtractor {
    private static final Logger LOGGER = AppLogger.get();

    static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    private final CoordinateConverter converter;

    public MetadataExtractor() {
        this(new CoordinateConverter());
    }

    public MetadataExtractor(CoordinateConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
    }

    public ImageRecord extract(Path path) throws UnreadableImageException {
        String filename = path.getFileName().toString();
        if (!Files.isRegularFile(path)) {
            throw new UnreadableImageException("Not a regular file: " + path);
        }

        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(path.toFile());
        } catch (ImageProcessingException ex) {
            throw new UnreadableImageException("Not a readable image: " + filename + " (" + ex.getMessage() + ")", ex);
        } catch (IOException ex) {
            throw new UnreadableImageException("Could not read " + filename + ": " + ex.getMessage(), ex);
        }

        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);

        ImageRecord.Builder builder = ImageRecord.builder(filename)
            .source(path)
            .description(readText(ifd0, ExifIFD0Directory.TAG_IMAGE_DESCRIPTION))
            .customName(readText(ifd0, ExifIFD0Directory.TAG_ARTIST))
            .orientation(Orientation.fromExifValue(ifd0 == null ? null : ifd0.getInteger(ExifIFD0Directory.TAG_ORIENTATION)))
            .captureTimestamp(readTimestamp(filename, subIfd, ifd0));

        if (gps != null) {
            applyCoordinates(builder, filename, gps);
        }
        return builder.build();
    }

    private void applyCoordinates(ImageRecord.Builder builder, String filename, GpsDirectory gps) {
        GeoPosition position;
        try {
            position = GpsTagDecoder.decode(
                toDoubles(gps.getRationalArray(GpsDirectory.TAG_LATITUDE)),
                gps.getString(GpsDirectory.TAG_LATITUDE_REF),
                toDoubles(gps.getRationalArray(GpsDirectory.TAG_LONGITUDE)),
                gps.getString(GpsDirectory.TAG_LONGITUDE_REF)
            );
        } catch (MissingFieldException ex) {
            LOGGER.fine(() -> "%s: no coordinates (%s)".formatted(filename, ex.getMessage()));
            return;
        } catch (ConversionException ex) {
            LOGGER.warning("%s: invalid GPS coordinates, ignoring them: %s".formatted(filename, ex.getMessage()));
            return;
        }

        builder.coordinates(position.latitude(), position.longitude());
        try {
            builder.projected(converter.convert(position.latitude(), position.longitude()));
        } catch (ConversionException ex) {
            LOGGER.warning("%s: UTM conversion failed for (%.5f, %.5f): %s"
                .formatted(filename, position.latitude(), position.longitude(), ex.getMessage()));
        }
    }

    /**
     * Prefers the original capture time over the generic IFD0 date/time.
     */
    private static LocalDateTime readTimestamp(String filename, ExifSubIFDDirectory subIfd, ExifIFD0Directory ifd0) {
        String raw = readText(subIfd, ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
        if (raw == null || raw.isBlank()) {
            raw = readText(ifd0, ExifIFD0Directory.TAG_DATETIME);
        }
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String cleaned = raw.trim();
        try {
            return LocalDateTime.parse(cleaned, EXIF_DATE_TIME);
        } catch (DateTimeParseException ex) {
            LOGGER.warning("%s: invalid date format '%s'".formatted(filename, cleaned));
            return null;
        }
    }

    private static String readText(Directory directory, int tag) {
        if (directory == null || !directory.containsTag(tag)) {
            return null;
        }
        StringValue value = directory.getStringValue(tag);
        String text = value != null ? value.toString(StandardCharsets.UTF_8) : directory.getString(tag);
        return text == null ? null : text.replace("\u0000", "");
    }

    private static double[] toDoubles(Rational[] rationals) {
        if (rationals == null) {
            return null;
        }
        double[] values = new double[rationals.length];
        for (int i = 0; i < rationals.length; i++) {
            values[i] = rationals[i].doubleValue();
        }
        return values;
    }
}
