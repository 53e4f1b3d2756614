package com.fotogeo.core.geo;

/**
 * Raised when a geographic position is outside the supported domain or the projection cannot represent it.
 */
public final class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
