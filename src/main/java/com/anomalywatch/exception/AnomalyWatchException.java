package com.anomalywatch.exception;

import lombok.Getter;

@Getter
public abstract class AnomalyWatchException extends RuntimeException {
    private final String errorCode;
    protected AnomalyWatchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected AnomalyWatchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
