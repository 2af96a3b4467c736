package com.anomalywatch.exception;

public class EmptyBatchException extends AnomalyWatchException {
    public EmptyBatchException(String source) {
        super("EMPTY_BATCH", source + " returned an empty batch.");
    }
}
