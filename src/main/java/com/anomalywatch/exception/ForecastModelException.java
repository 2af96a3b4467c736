package com.anomalywatch.exception;

public class ForecastModelException extends AnomalyWatchException {
    public ForecastModelException(String message) {
        super("FORECAST_MODEL_ERROR", message);
    }
    public ForecastModelException(String message, Throwable cause) {
        super("FORECAST_MODEL_ERROR", message, cause);
    }
}
