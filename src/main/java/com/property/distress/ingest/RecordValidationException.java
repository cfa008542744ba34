package com.property.distress.ingest;

/**
 * A single source row cannot be turned into a record. The loader counts the row as
 * failed and moves on.
 */
public class RecordValidationException extends RuntimeException {

    private final long rowNumber;
    private final String column;

    public RecordValidationException(long rowNumber, String column, String message) {
        super("Row " + rowNumber + ", column '" + column + "': " + message);
        this.rowNumber = rowNumber;
        this.column = column;
    }

    public long getRowNumber() {
        return rowNumber;
    }

    public String getColumn() {
        return column;
    }
}
