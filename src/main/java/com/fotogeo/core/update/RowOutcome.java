package com.fotogeo.core.update;

/**
 * Final state of one edited row. Each row reaches exactly one of these states.
 */
public record RowOutcome(int rowNumber, String filename, Status status, String reason) {

    public enum Status {
        UPDATED,
        WRITE_FAILED,
        UNMATCHED,
        /** Several rows name the same file; none of them is applied. */
        AMBIGUOUS,
        /** The table carries neither editable column. */
        NO_EDITABLE_COLUMNS,
        /** The edited values already match the photo; the file is not rewritten. */
        UNCHANGED
    }

    static RowOutcome updated(int rowNumber, String filename) {
        return new RowOutcome(rowNumber, filename, Status.UPDATED, null);
    }

    static RowOutcome unchanged(int rowNumber, String filename) {
        return new RowOutcome(rowNumber, filename, Status.UNCHANGED, null);
    }

    public boolean isUpdated() {
        return status == Status.UPDATED;
    }

    public boolean isSkipped() {
        return status != Status.UPDATED && status != Status.UNCHANGED;
    }
}
