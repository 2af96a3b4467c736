package com.anomalywatch.exception;

public class InvalidWorkflowException extends AnomalyWatchException {
    public InvalidWorkflowException(String message) {
        super("INVALID_WORKFLOW", message);
    }
}
