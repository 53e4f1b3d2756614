package com.fotogeo.core.image;

/**
 * JPEG-encoded, orientation-corrected preview of a photo.
 */
public record Thumbnail(byte[] jpeg, int width, int height) {
}
