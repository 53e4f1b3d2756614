package com.fotogeo.core.model;

/**
 * One row of an edited table. A {@code null} edited value means the column was not present in the table,
 * so the photo keeps its current tag.
 *
 * @param rowNumber 1-based row number in the source table, used in skip reasons
 */
public record UpdateRow(int rowNumber, String filename, String customNameEdited, String descriptionEdited) {

    public UpdateRow {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename cannot be blank");
        }
    }
}
