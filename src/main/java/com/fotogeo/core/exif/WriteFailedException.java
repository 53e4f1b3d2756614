package com.fotogeo.core.exif;

/**
 * Signals that edited tags could not be persisted. The photo is left exactly as it was.
 */
public class WriteFailedException extends Exception {
    public WriteFailedException(String message) {
        super(message);
    }

    public WriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
