package com.fotogeo.core.model;

/**
 * A file or row that a batch operation left out, together with the reason reported to the user.
 */
public record SkippedItem(String filename, String reason) {
}
