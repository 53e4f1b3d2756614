package com.fotogeo.core.exif;

/**
 * Raised when a file cannot be opened as an image at all (corrupt container or unsupported format).
 */
public final class UnreadableImageException extends Exception {

    public UnreadableImageException(String message) {
        super(message);
    }

    public UnreadableImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
