package com.fotogeo.core.exif;

import java.nio.file.Path;

/**
 * Rewrites the description and artist tags of a photo without touching any other tag or the pixel data.
 */
public interface ImageTagWriter {

    /**
     * @param description new ImageDescription; {@code null} keeps the current value, empty removes the tag
     * @param artist      new Artist; {@code null} keeps the current value, empty removes the tag
     */
    void writeTags(Path photo, String description, String artist) throws WriteFailedException;
}
