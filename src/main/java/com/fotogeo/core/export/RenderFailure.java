package com.fotogeo.core.export;

/**
 * A record that was rendered incompletely, or a format that failed altogether ({@code filename} null).
 */
public record RenderFailure(ExportFormat format, String filename, String reason) {
}
