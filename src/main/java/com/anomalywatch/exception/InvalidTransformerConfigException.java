package com.anomalywatch.exception;

public class InvalidTransformerConfigException extends AnomalyWatchException {
    public InvalidTransformerConfigException(String message) {
        super("INVALID_TRANSFORMER_CONFIG", message);
    }
}
