package com.anomalywatch.exception;

public class NonNumericValueException extends AnomalyWatchException {
    public NonNumericValueException(String column, Object value) {
        super("NON_NUMERIC_VALUE", "Column '" + column + "' holds non-numeric value '" + value + "'.");
    }
}
