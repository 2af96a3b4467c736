package com.anomalywatch.exception;

public class InvalidDateException extends AnomalyWatchException {
    public InvalidDateException(String column, Object value) {
        super("INVALID_DATE", value == null
            ? "Column '" + column + "' has a row without a date."
            : "Column '" + column + "' holds '" + value + "', which is not an ISO-8601 date.");
    }
}
