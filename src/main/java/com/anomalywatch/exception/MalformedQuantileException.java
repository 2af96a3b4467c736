package com.anomalywatch.exception;

public class MalformedQuantileException extends AnomalyWatchException {
    public MalformedQuantileException(String cell, String reason) {
        super("MALFORMED_QUANTILE", "Cannot parse quantile vector '" + cell + "': " + reason);
    }
    public MalformedQuantileException(String cell, String reason, Throwable cause) {
        super("MALFORMED_QUANTILE", "Cannot parse quantile vector '" + cell + "': " + reason, cause);
    }
}
