package com.churchadmin.importer;

/**
 * Outcome of validating one row: either an accepted value or a rejection reason, never both.
 */
public record RowResult<T>(int lineNumber, T value, String reason) {

    public static <T> RowResult<T> accepted(int lineNumber, T value) {
        return new RowResult<>(lineNumber, value, null);
    }

    public static <T> RowResult<T> rejected(int lineNumber, String reason) {
        return new RowResult<>(lineNumber, null, reason);
    }

    public boolean isAccepted() {
        return reason == null;
    }

    /**
     * Re-types a rejection so it can be returned from a caller with a different value type.
     */
    public <U> RowResult<U> asRejection() {
        if (isAccepted()) {
            throw new IllegalStateException("Row " + lineNumber + " was accepted");
        }
        return rejected(lineNumber, reason);
    }

    public String errorMessage() {
        return "Row " + lineNumber + ": " + reason;
    }
}
