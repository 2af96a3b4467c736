package com.anomalywatch.exception;

public class BatchSourceException extends AnomalyWatchException {
    public BatchSourceException(String message) {
        super("BATCH_SOURCE_ERROR", message);
    }
    public BatchSourceException(String message, Throwable cause) {
        super("BATCH_SOURCE_ERROR", message, cause);
    }
}
