package com.fotogeo.core.exif;

import com.fotogeo.core.geo.ConversionException;
import com.fotogeo.core.geo.GeoPosition;
import com.fotogeo.logging.AppLogger;

import java.util.Locale;
import java.util.logging.Logger;

/**
 * Turns the GPS sub-fields (degree/minute/second triples plus N/S/E/W references) into decimal degrees.
 */
public final class GpsTagDecoder {
    private static final Logger LOGGER = AppLogger.get();

    private GpsTagDecoder() {
    }

    public static GeoPosition decode(double[] latitudeDms,
                                     String latitudeRef,
                                     double[] longitudeDms,
                                     String longitudeRef) throws MissingFieldException, ConversionException {
        if (latitudeDms == null) throw new MissingFieldException("GPSLatitude");
        if (latitudeRef == null || latitudeRef.isBlank()) throw new MissingFieldException("GPSLatitudeRef");
        if (longitudeDms == null) throw new MissingFieldException("GPSLongitude");
        if (longitudeRef == null || longitudeRef.isBlank()) throw new MissingFieldException("GPSLongitudeRef");

        GeoPosition position = new GeoPosition(
            toDecimal(latitudeDms, latitudeRef, 'N', 'S'),
            toDecimal(longitudeDms, longitudeRef, 'E', 'W')
        );
        if (!position.isInRange()) {
            throw new ConversionException("Decoded coordinates out of range: (%.7f, %.7f)"
                .formatted(position.latitude(), position.longitude()));
        }
        return position;
    }

    /**
     * Combines degrees, minutes and seconds and applies the sign implied by the reference letter.
     */
    static double toDecimal(double[] dms, String reference, char positive, char negative) throws ConversionException {
        if (dms.length != 3) {
            throw new ConversionException("Expected degrees/minutes/seconds, got " + dms.length + " components");
        }
        double degrees = dms[0];
        double minutes = dms[1];
        double seconds = dms[2];
        if (!Double.isFinite(degrees) || !Double.isFinite(minutes) || !Double.isFinite(seconds)) {
            throw new ConversionException("Non-finite DMS component: D=%s, M=%s, S=%s".formatted(degrees, minutes, seconds));
        }
        if (minutes < 0 || minutes >= 60 || seconds < 0 || seconds >= 60) {
            LOGGER.fine(() -> "DMS values outside the usual range (M=%s, S=%s), continuing".formatted(minutes, seconds));
        }
        double decimal = degrees + minutes / 60.0 + seconds / 3600.0;
        char ref = reference.trim().toUpperCase(Locale.ROOT).charAt(0);
        if (ref == positive) {
            return decimal;
        }
        if (ref == negative) {
            return -decimal;
        }
        throw new ConversionException("Unknown GPS reference '" + reference + "'");
    }
}
