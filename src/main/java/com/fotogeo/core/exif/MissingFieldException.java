package com.fotogeo.core.exif;

/**
 * Raised when an expected tag is absent. Callers generally treat it as "field absent" rather than a failure.
 */
public final class MissingFieldException extends Exception {
    private final String field;

    public MissingFieldException(String field) {
        super("Missing tag: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
